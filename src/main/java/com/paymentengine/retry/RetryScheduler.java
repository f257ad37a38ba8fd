package com.paymentengine.retry;

import com.paymentengine.payments.PaymentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff for failed charges.
 *
 * The delay is base^retryCount hours using the count before this failure is
 * added: 1h, 4h, 16h with the default base of 4. The scheduler only decides;
 * the caller increments retryCount in the same write that stores nextRetryAt.
 */
@Component
@Slf4j
public class RetryScheduler {

    private final long backoffBase;

    public RetryScheduler(@Value("${payment-engine.retry.backoff-base:4}") long backoffBase) {
        if (backoffBase < 2) {
            throw new IllegalArgumentException("Backoff base must be at least 2: " + backoffBase);
        }
        this.backoffBase = backoffBase;
    }

    public RetryDecision computeNextRetry(PaymentRecord record, Instant now) {
        return computeNextRetry(record.getRetryCount(), record.getMaxRetries(), now);
    }

    public RetryDecision computeNextRetry(int retryCount, int maxRetries, Instant now) {
        if (retryCount + 1 >= maxRetries) {
            log.debug("No retry left: retryCount={}, maxRetries={}", retryCount, maxRetries);
            return RetryDecision.giveUp();
        }
        return RetryDecision.retryAt(now.plus(backoff(retryCount)));
    }

    public Duration backoff(int retryCount) {
        long hours = 1;
        for (int i = 0; i < retryCount; i++) {
            hours = Math.multiplyExact(hours, backoffBase);
        }
        return Duration.ofHours(hours);
    }
}
