package com.paymentengine.reconciliation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of one pass over the due payments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private Instant startedAt;
    private Instant completedAt;

    @Builder.Default
    private int processed = 0;

    @Builder.Default
    private int succeeded = 0;

    @Builder.Default
    private int retryScheduled = 0;

    @Builder.Default
    private int failed = 0;

    @Builder.Default
    private int actionRequired = 0;

    /**
     * Due when listed but claimed by another worker first.
     */
    @Builder.Default
    private int skipped = 0;

    @Builder.Default
    private int errors = 0;

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
