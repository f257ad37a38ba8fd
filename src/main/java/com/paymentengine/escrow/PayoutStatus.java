package com.paymentengine.escrow;

public enum PayoutStatus {
    PENDING,
    SCHEDULED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
}
