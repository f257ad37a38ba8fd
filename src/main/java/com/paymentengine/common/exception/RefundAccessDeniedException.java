package com.paymentengine.common.exception;

/**
 * Thrown when someone other than the requester tries to withdraw a refund request.
 */
public class RefundAccessDeniedException extends PaymentEngineException {

    public RefundAccessDeniedException(String refundId, String userId) {
        super(String.format("User %s did not request refund %s", userId, refundId));
    }
}
