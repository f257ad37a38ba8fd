package com.paymentengine.common;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Generation and validation of idempotency keys.
 *
 * Keys handed to the card processor and the ledger are derived from stable
 * identifiers, so re-sending the same request produces the same key and the
 * receiving side can collapse the duplicate.
 */
public final class IdempotencyKey {

    private IdempotencyKey() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * Deterministic key for a namespace and a list of identifying parts.
     */
    public static String derive(String namespace, Object... parts) {
        StringBuilder seed = new StringBuilder(namespace);
        for (Object part : parts) {
            seed.append(':').append(part);
        }
        return UUID.nameUUIDFromBytes(seed.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Key for one business attempt to charge a payment record.
     * Connection-level re-sends of the attempt reuse it; the next attempt gets a new one.
     */
    public static String forChargeAttempt(String paymentId, int retryCount, int manualRetryCount) {
        return derive("charge", paymentId, retryCount, manualRetryCount);
    }

    public static boolean isValid(String key) {
        if (key == null || key.trim().isEmpty()) {
            return false;
        }
        try {
            UUID.fromString(key);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static void validate(String key) {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Invalid idempotency key: " + key);
        }
    }
}
