package com.paymentengine.escrow;

public enum EscrowHoldStatus {
    HELD,
    RELEASED,
    REFUNDED
}
