package com.paymentengine.common.exception;

/**
 * Thrown when a booking cannot be cancelled or completed from its current status.
 */
public class InvalidBookingStateException extends PaymentEngineException {

    public InvalidBookingStateException(String bookingId, String currentState, String operation) {
        super(String.format("Cannot %s booking %s in state %s", operation, bookingId, currentState));
    }
}
