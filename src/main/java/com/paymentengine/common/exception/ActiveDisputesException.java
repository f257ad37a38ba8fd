package com.paymentengine.common.exception;

/**
 * Thrown when an early payout is refused because the booking has open disputes.
 * The payout schedule has already been reverted to PENDING when this is raised.
 */
public class ActiveDisputesException extends PayoutRejectedException {

    public ActiveDisputesException(String scheduleId, String bookingId) {
        super(scheduleId, "active disputes exist for booking " + bookingId);
    }
}
