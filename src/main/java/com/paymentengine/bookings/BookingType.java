package com.paymentengine.bookings;

/**
 * Kind of work booked. Determines how long a provider waits for payout.
 */
public enum BookingType {
    JOB,
    SERVICE,
    CUSTOM_SERVICE
}
