package com.paymentengine.processor;

import com.paymentengine.common.exception.PaymentEngineException;

/**
 * Error reported by a card processor, carrying the processor's own error code.
 */
public class ProcessorException extends PaymentEngineException {

    private final String processorCode;

    public ProcessorException(String processorCode, String message) {
        super(message);
        this.processorCode = processorCode;
    }

    public ProcessorException(String processorCode, String message, Throwable cause) {
        super(message, cause);
        this.processorCode = processorCode;
    }

    public String getProcessorCode() {
        return processorCode;
    }
}
