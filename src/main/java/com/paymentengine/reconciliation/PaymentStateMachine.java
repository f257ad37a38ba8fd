package com.paymentengine.reconciliation;

import com.paymentengine.common.exception.InvalidPaymentStateException;
import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentStatus;
import com.paymentengine.processor.ChargeFailureCode;
import com.paymentengine.processor.ChargeResult;
import com.paymentengine.retry.RetryDecision;
import com.paymentengine.retry.RetryScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Lifecycle of a payment record.
 *
 * <pre>
 * PENDING    --CLAIM (due)-------------------------&gt; PROCESSING
 * PROCESSING --CHARGE_SUCCEEDED--------------------&gt; SUCCEEDED
 * PROCESSING --CHARGE_FAILED, retry left-----------&gt; PENDING (retryCount + 1)
 * PROCESSING --CHARGE_FAILED, no retry left--------&gt; FAILED, agreement paused
 * PROCESSING --CHARGE_FAILED, needs authentication-&gt; FAILED
 * PENDING | FAILED --MANUAL_RETRY------------------&gt; PENDING (retryCount 0)
 * PENDING | FAILED --CANCEL------------------------&gt; CANCELLED
 * </pre>
 *
 * Transitions are computed, not applied: the record passed in is never modified.
 * Every pair not listed above throws {@link InvalidPaymentStateException}, except
 * CANCEL on an already cancelled record, which is a no-op.
 */
@Component
@RequiredArgsConstructor
public class PaymentStateMachine {

    private final RetryScheduler retryScheduler;

    public PaymentTransition transition(PaymentRecord record, PaymentEvent event) {
        switch (event.getType()) {
            case CLAIM:
                return claim(record, event);
            case CHARGE_SUCCEEDED:
                return chargeSucceeded(record, event);
            case CHARGE_FAILED:
                return chargeFailed(record, event);
            case MANUAL_RETRY:
                return manualRetry(record);
            case CANCEL:
                return cancel(record);
            default:
                throw reject(record, event.getType());
        }
    }

    public boolean isClaimable(PaymentRecord record, Instant now) {
        return record.isDue(now);
    }

    private PaymentTransition claim(PaymentRecord record, PaymentEvent event) {
        if (!isClaimable(record, event.getAt())) {
            throw reject(record, PaymentEventType.CLAIM);
        }
        return PaymentTransition.from(record)
            .status(PaymentStatus.PROCESSING)
            .nextRetryAt(null)
            .build();
    }

    private PaymentTransition chargeSucceeded(PaymentRecord record, PaymentEvent event) {
        requireStatus(record, PaymentEventType.CHARGE_SUCCEEDED, PaymentStatus.PROCESSING);
        return PaymentTransition.from(record)
            .status(PaymentStatus.SUCCEEDED)
            .chargedAt(event.getAt())
            .externalTransactionReference(event.getChargeResult().getExternalReference())
            .nextRetryAt(null)
            .failureReason(null)
            .failureCode(null)
            .effect(PaymentEffect.RECORD_LEDGER_PAYMENT)
            .build();
    }

    private PaymentTransition chargeFailed(PaymentRecord record, PaymentEvent event) {
        requireStatus(record, PaymentEventType.CHARGE_FAILED, PaymentStatus.PROCESSING);
        ChargeResult result = event.getChargeResult();
        ChargeFailureCode code = result.getFailureCode();

        PaymentTransition.PaymentTransitionBuilder failed = PaymentTransition.from(record)
            .failureCode(code)
            .failureReason(result.getFailureReason())
            .chargedAt(null);

        if (!code.isRetryable()) {
            return failed
                .status(PaymentStatus.FAILED)
                .nextRetryAt(null)
                .effect(PaymentEffect.NOTIFY_ACTION_REQUIRED)
                .build();
        }

        RetryDecision decision = retryScheduler.computeNextRetry(record, event.getAt());
        if (decision.isShouldRetry()) {
            return failed
                .status(PaymentStatus.PENDING)
                .retryCount(record.getRetryCount() + 1)
                .nextRetryAt(decision.getNextRetryAt())
                .effect(PaymentEffect.NOTIFY_RETRY_SCHEDULED)
                .build();
        }

        return failed
            .status(PaymentStatus.FAILED)
            .nextRetryAt(null)
            .effect(PaymentEffect.NOTIFY_PERMANENT_FAILURE)
            .effect(PaymentEffect.PAUSE_AGREEMENT)
            .build();
    }

    private PaymentTransition manualRetry(PaymentRecord record) {
        requireStatus(record, PaymentEventType.MANUAL_RETRY, PaymentStatus.PENDING, PaymentStatus.FAILED);
        return PaymentTransition.from(record)
            .status(PaymentStatus.PENDING)
            .retryCount(0)
            .nextRetryAt(null)
            .manualRetryCount(record.getManualRetryCount() + 1)
            .build();
    }

    private PaymentTransition cancel(PaymentRecord record) {
        if (record.getStatus() == PaymentStatus.CANCELLED) {
            return PaymentTransition.unchanged(record);
        }
        requireStatus(record, PaymentEventType.CANCEL, PaymentStatus.PENDING, PaymentStatus.FAILED);
        return PaymentTransition.from(record)
            .status(PaymentStatus.CANCELLED)
            .nextRetryAt(null)
            .build();
    }

    private void requireStatus(PaymentRecord record, PaymentEventType type, PaymentStatus... allowed) {
        for (PaymentStatus status : allowed) {
            if (record.getStatus() == status) {
                return;
            }
        }
        throw reject(record, type);
    }

    private InvalidPaymentStateException reject(PaymentRecord record, PaymentEventType type) {
        return new InvalidPaymentStateException(record.getPaymentId(), record.getStatus().name(), type.name());
    }
}
