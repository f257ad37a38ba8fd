package com.paymentengine.escrow;

import com.paymentengine.common.Money;
import lombok.Value;

@Value
public class EarlyPayoutResult {

    boolean success;
    Money payoutAmount;
    String scheduleId;
    String ledgerTransactionId;
}
