package com.paymentengine.common.exception;

/**
 * Thrown when a refund is completed or withdrawn from the wrong status.
 */
public class InvalidRefundStateException extends PaymentEngineException {

    public InvalidRefundStateException(String refundId, String currentState, String operation) {
        super(String.format("Cannot %s refund %s in state %s", operation, refundId, currentState));
    }
}
