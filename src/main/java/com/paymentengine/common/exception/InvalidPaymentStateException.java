package com.paymentengine.common.exception;

/**
 * Thrown when an operation is not allowed from the payment record's current status.
 */
public class InvalidPaymentStateException extends PaymentEngineException {

    public InvalidPaymentStateException(String paymentId, String currentState, String operation) {
        super(String.format("Cannot perform operation '%s' on payment %s in state %s",
            operation, paymentId, currentState));
    }
}
