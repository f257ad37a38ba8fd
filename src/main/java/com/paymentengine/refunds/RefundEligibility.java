package com.paymentengine.refunds;

import com.paymentengine.common.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Refund a cancellation qualifies for. {@code reason} is set only when not eligible.
 */
@Value
@Builder
public class RefundEligibility {

    boolean eligible;
    int refundPercentage;
    Money refundAmount;
    Money originalAmount;
    long daysUntilService;
    String policy;
    String reason;

    static RefundEligibility rejected(Money originalAmount, long daysUntilService, String policy, String reason) {
        return RefundEligibility.builder()
            .eligible(false)
            .refundPercentage(0)
            .refundAmount(Money.zero(originalAmount.getCurrency()))
            .originalAmount(originalAmount)
            .daysUntilService(daysUntilService)
            .policy(policy)
            .reason(reason)
            .build();
    }
}
