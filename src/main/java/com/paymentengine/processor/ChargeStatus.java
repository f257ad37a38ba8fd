package com.paymentengine.processor;

public enum ChargeStatus {
    SUCCEEDED,
    FAILED
}
