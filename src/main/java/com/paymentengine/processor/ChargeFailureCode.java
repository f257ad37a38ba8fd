package com.paymentengine.processor;

/**
 * Failure taxonomy for card charges, independent of the processor in use.
 */
public enum ChargeFailureCode {
    /**
     * Issuer declined the card. Retried on the normal schedule; the card may be fixed by then.
     */
    CARD_DECLINED(true, true),

    /**
     * Not enough funds. Retried on the normal schedule; funds may be added by then.
     */
    INSUFFICIENT_FUNDS(true, true),

    /**
     * Step-up verification required. Never retried automatically: waiting cannot fix it.
     */
    AUTHENTICATION_REQUIRED(false, true),

    /**
     * Processor outage, network error or timeout.
     */
    PROCESSOR_UNAVAILABLE(true, false);

    private final boolean retryable;
    private final boolean shownToPayer;

    ChargeFailureCode(boolean retryable, boolean shownToPayer) {
        this.retryable = retryable;
        this.shownToPayer = shownToPayer;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether the payer sees the reason itself rather than only "retry scheduled".
     */
    public boolean isShownToPayer() {
        return shownToPayer;
    }
}
