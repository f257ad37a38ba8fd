package com.paymentengine.processor;

import com.paymentengine.common.IdempotencyKey;
import com.paymentengine.common.Money;
import com.paymentengine.payments.PaymentRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Instruction to charge a payment instrument once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargeRequest {

    private String paymentId;

    private String payerId;

    private String instrumentId;

    private Money amount;

    /**
     * Stable per business attempt; see {@link IdempotencyKey#forChargeAttempt}.
     */
    private String idempotencyKey;

    public static ChargeRequest forAttempt(PaymentRecord record) {
        return ChargeRequest.builder()
            .paymentId(record.getPaymentId())
            .payerId(record.getPayerId())
            .instrumentId(record.getInstrumentId())
            .amount(record.getAmount())
            .idempotencyKey(IdempotencyKey.forChargeAttempt(
                record.getPaymentId(), record.getRetryCount(), record.getManualRetryCount()))
            .build();
    }
}
