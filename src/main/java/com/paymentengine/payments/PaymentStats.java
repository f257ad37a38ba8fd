package com.paymentengine.payments;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-payer totals across recurring payment records.
 * successRate is succeeded / (succeeded + failed) as a percentage.
 */
@Value
@Builder
public class PaymentStats {
    BigDecimal totalPaid;
    BigDecimal totalPending;
    BigDecimal totalFailed;
    BigDecimal successRate;
}
