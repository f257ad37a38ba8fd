package com.paymentengine.refunds;

public enum RefundStatus {
    PENDING,
    COMPLETED,
    REJECTED
}
