package com.paymentengine.common.exception;

/**
 * Thrown when a payment record is not found.
 */
public class PaymentNotFoundException extends ResourceNotFoundException {

    public PaymentNotFoundException(String paymentId) {
        super("Payment", paymentId);
    }
}
