package com.paymentengine.common.exception;

/**
 * Thrown when a refund is requested for a booking that does not qualify.
 */
public class RefundNotEligibleException extends PaymentEngineException {

    private final String reason;

    public RefundNotEligibleException(String bookingId, String reason) {
        super(String.format("Booking %s is not eligible for a refund: %s", bookingId, reason));
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
