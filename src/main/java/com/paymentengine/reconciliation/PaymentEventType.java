package com.paymentengine.reconciliation;

public enum PaymentEventType {
    CLAIM,
    CHARGE_SUCCEEDED,
    CHARGE_FAILED,
    MANUAL_RETRY,
    CANCEL
}
