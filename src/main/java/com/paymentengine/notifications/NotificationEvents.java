package com.paymentengine.notifications;

import com.paymentengine.common.Money;
import com.paymentengine.payments.PaymentRecord;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Wording of the notifications the engine sends.
 */
public final class NotificationEvents {

    private static final DateTimeFormatter RETRY_TIME =
        DateTimeFormatter.ofPattern("MMM d, yyyy HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private NotificationEvents() {
    }

    public static NotificationEvent retryScheduled(PaymentRecord payment) {
        String reason = payment.getFailureCode() != null && payment.getFailureCode().isShownToPayer()
            ? " Reason: " + payment.getFailureReason() + "."
            : "";
        return new NotificationEvent(
            payment.getPayerId(),
            "Payment Retry Scheduled",
            String.format("Your recurring payment of %s failed.%s We'll retry automatically on %s. "
                    + "Please ensure your payment method is valid.",
                payment.getAmount(), reason, formatRetryTime(payment.getNextRetryAt())),
            NotificationType.PAYMENT_RETRY_SCHEDULED,
            payment.getPaymentId()
        );
    }

    public static NotificationEvent permanentFailure(PaymentRecord payment) {
        return new NotificationEvent(
            payment.getPayerId(),
            "Recurring Payment Failed",
            String.format("Your recurring booking payment of %s could not be processed after multiple attempts. "
                    + "Future billing has been paused. Please update your payment method and resume the booking. "
                    + "Reason: %s",
                payment.getAmount(), payment.getFailureReason()),
            NotificationType.PAYMENT_FAILED,
            payment.getPaymentId()
        );
    }

    public static NotificationEvent actionRequired(PaymentRecord payment) {
        return new NotificationEvent(
            payment.getPayerId(),
            "Action Required for Your Payment",
            String.format("Your recurring payment of %s needs you to verify it with your card issuer "
                    + "before it can go through. It will not be retried automatically. Reason: %s",
                payment.getAmount(), payment.getFailureReason()),
            NotificationType.PAYMENT_ACTION_REQUIRED,
            payment.getPaymentId()
        );
    }

    public static NotificationEvent earlyPayoutCompleted(String providerId, Money amount, String scheduleId) {
        return new NotificationEvent(
            providerId,
            "Early Payout Completed",
            String.format("Your early payout of %s has been released to your wallet.", amount),
            NotificationType.EARLY_PAYOUT_COMPLETED,
            scheduleId
        );
    }

    public static NotificationEvent refundIssued(String customerId, Money amount, int percentage, String refundId) {
        return new NotificationEvent(
            customerId,
            "Refund Issued",
            String.format("A refund of %s (%d%%) has been credited to your wallet.", amount, percentage),
            NotificationType.REFUND_ISSUED,
            refundId
        );
    }

    static String formatRetryTime(Instant instant) {
        return instant == null ? "a later date" : RETRY_TIME.format(instant);
    }
}
