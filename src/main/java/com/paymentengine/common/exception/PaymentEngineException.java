package com.paymentengine.common.exception;

/**
 * Base exception for all payment engine exceptions.
 */
public class PaymentEngineException extends RuntimeException {

    public PaymentEngineException(String message) {
        super(message);
    }

    public PaymentEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
