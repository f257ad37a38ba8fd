package com.paymentengine.ledger;

/**
 * What produced a ledger transaction.
 */
public enum ReferenceType {
    PAYMENT_RECORD,
    ESCROW_HOLD,
    REFUND
}
