package com.paymentengine.refunds;

import com.paymentengine.common.Money;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Cancellation refund policy.
 *
 * <pre>
 * provider cancels          100%
 * customer, 7+ days out     100%
 * customer, 3-6 days out     50%
 * customer, 1-2 days out     25%
 * customer, same day          0%
 * </pre>
 *
 * Days are counted between calendar dates, so the time of day of the
 * cancellation does not matter. The result depends only on the arguments.
 */
@Component
public class RefundEligibilityEngine {

    static final String FULL_POLICY = "Full refund (100%) - Cancelling 7+ days before service";
    static final String HALF_POLICY = "Partial refund (50%) - Cancelling 3-6 days before service";
    static final String QUARTER_POLICY = "Partial refund (25%) - Cancelling 1-2 days before service";
    static final String NO_REFUND_POLICY = "No refund - Cancelling within 24 hours of service";
    static final String PROVIDER_POLICY = "Full refund (100%) - Provider cancelled the booking";
    static final String NO_REFUND_REASON = "No refund — cancelling within 24 hours of service";

    public RefundEligibility evaluate(LocalDate scheduledDate, CancellingParty cancelledBy,
                                      Money originalAmount, LocalDate today) {
        long daysUntilService = ChronoUnit.DAYS.between(today, scheduledDate);

        if (cancelledBy == CancellingParty.PROVIDER) {
            return eligible(originalAmount, 100, daysUntilService, PROVIDER_POLICY);
        }
        if (daysUntilService >= 7) {
            return eligible(originalAmount, 100, daysUntilService, FULL_POLICY);
        }
        if (daysUntilService >= 3) {
            return eligible(originalAmount, 50, daysUntilService, HALF_POLICY);
        }
        if (daysUntilService >= 1) {
            return eligible(originalAmount, 25, daysUntilService, QUARTER_POLICY);
        }
        return RefundEligibility.rejected(originalAmount, daysUntilService, NO_REFUND_POLICY, NO_REFUND_REASON);
    }

    private RefundEligibility eligible(Money originalAmount, int percentage, long daysUntilService, String policy) {
        return RefundEligibility.builder()
            .eligible(true)
            .refundPercentage(percentage)
            .refundAmount(originalAmount.percentage(percentage))
            .originalAmount(originalAmount)
            .daysUntilService(daysUntilService)
            .policy(policy)
            .build();
    }
}
