package com.paymentengine.payments;

/**
 * Lifecycle states of a payment record.
 */
public enum PaymentStatus {
    /**
     * Waiting for a charge attempt, either first or a scheduled retry.
     */
    PENDING,

    /**
     * A charge attempt is in flight. At most one worker holds a record in this state.
     */
    PROCESSING,

    /**
     * Charged. Terminal.
     */
    SUCCEEDED,

    /**
     * Retries exhausted or payer action required. Terminal for the automated path.
     */
    FAILED,

    /**
     * Cancelled by the payer. Terminal.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
