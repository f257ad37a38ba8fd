package com.paymentengine.reconciliation;

import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentStatus;
import com.paymentengine.processor.ChargeFailureCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * The full mutable state of a payment record after an event, plus the effects
 * to run in the same transaction.
 */
@Value
@Builder(toBuilder = true)
public class PaymentTransition {

    PaymentStatus status;
    int retryCount;
    int manualRetryCount;
    Instant nextRetryAt;
    String failureReason;
    ChargeFailureCode failureCode;
    Instant chargedAt;
    String externalTransactionReference;

    @Singular
    List<PaymentEffect> effects;

    /**
     * False for an event that leaves the record as it was.
     */
    boolean changed;

    /**
     * Builder seeded with the record's current state.
     */
    static PaymentTransitionBuilder from(PaymentRecord record) {
        return PaymentTransition.builder()
            .status(record.getStatus())
            .retryCount(record.getRetryCount())
            .manualRetryCount(record.getManualRetryCount())
            .nextRetryAt(record.getNextRetryAt())
            .failureReason(record.getFailureReason())
            .failureCode(record.getFailureCode())
            .chargedAt(record.getChargedAt())
            .externalTransactionReference(record.getExternalTransactionReference())
            .changed(true);
    }

    static PaymentTransition unchanged(PaymentRecord record) {
        return from(record).changed(false).build();
    }

    public boolean hasEffect(PaymentEffect effect) {
        return effects.contains(effect);
    }
}
