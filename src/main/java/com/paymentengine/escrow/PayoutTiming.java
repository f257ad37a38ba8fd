package com.paymentengine.escrow;

import com.paymentengine.bookings.BookingType;

/**
 * Payout waiting periods per booking type, in days.
 * Cutoff is the hold after completion, cycle is the payout run interval that follows,
 * early is how soon a provider may ask for early release.
 */
enum PayoutTiming {
    JOB(3, 7, 3),
    SERVICE(5, 14, 7);

    private final int cutoffDays;
    private final int cycleDays;
    private final int earlyDays;

    PayoutTiming(int cutoffDays, int cycleDays, int earlyDays) {
        this.cutoffDays = cutoffDays;
        this.cycleDays = cycleDays;
        this.earlyDays = earlyDays;
    }

    static PayoutTiming forBookingType(BookingType type) {
        return type == BookingType.JOB ? JOB : SERVICE;
    }

    int getCutoffDays() {
        return cutoffDays;
    }

    int getCycleDays() {
        return cycleDays;
    }

    int getEarlyDays() {
        return earlyDays;
    }
}
