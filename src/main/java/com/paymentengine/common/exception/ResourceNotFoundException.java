package com.paymentengine.common.exception;

/**
 * Thrown when a referenced record does not exist.
 */
public class ResourceNotFoundException extends PaymentEngineException {

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
    }
}
