package com.paymentengine.bookings;

public enum BookingEscrowStatus {
    NONE,
    HELD,
    RELEASED,
    REFUNDED
}
