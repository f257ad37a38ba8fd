package com.paymentengine.retry;

import lombok.Value;

import java.time.Instant;

/**
 * Whether a failed payment gets another automatic attempt, and when.
 */
@Value
public class RetryDecision {
    boolean shouldRetry;
    Instant nextRetryAt;

    public static RetryDecision retryAt(Instant nextRetryAt) {
        return new RetryDecision(true, nextRetryAt);
    }

    public static RetryDecision giveUp() {
        return new RetryDecision(false, null);
    }
}
