package com.paymentengine.payments;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for payment records.
 */
@Repository
public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, String> {

    @Query("SELECT p FROM PaymentRecord p WHERE p.status = com.paymentengine.payments.PaymentStatus.PENDING " +
           "AND (p.nextRetryAt IS NULL OR p.nextRetryAt <= :now) ORDER BY p.createdAt ASC")
    List<PaymentRecord> findDue(@Param("now") Instant now);

    List<PaymentRecord> findByAgreementIdOrderByCreatedAtDesc(String agreementId);

    List<PaymentRecord> findByAgreementIdAndStatus(String agreementId, PaymentStatus status);

    List<PaymentRecord> findByPayerId(String payerId);

    /**
     * Compare-and-swap PENDING to PROCESSING for a record due at {@code now}.
     * Returns 1 for the single caller that wins, 0 for everyone else. {@code claimedAt}
     * is the wall-clock time the stale-claim sweep measures from.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRecord p SET p.status = com.paymentengine.payments.PaymentStatus.PROCESSING, " +
           "p.nextRetryAt = NULL, p.updatedAt = :claimedAt, p.version = p.version + 1 " +
           "WHERE p.paymentId = :paymentId AND p.status = com.paymentengine.payments.PaymentStatus.PENDING " +
           "AND (p.nextRetryAt IS NULL OR p.nextRetryAt <= :now)")
    int claimForProcessing(@Param("paymentId") String paymentId,
                           @Param("now") Instant now,
                           @Param("claimedAt") Instant claimedAt);

    /**
     * Return first-attempt claims older than the cutoff to PENDING. The attempt is
     * re-sent with the same idempotency key, so the processor replays rather than
     * charging again.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRecord p SET p.status = com.paymentengine.payments.PaymentStatus.PENDING, " +
           "p.updatedAt = :now, p.version = p.version + 1 " +
           "WHERE p.status = com.paymentengine.payments.PaymentStatus.PROCESSING " +
           "AND p.retryCount = 0 AND p.updatedAt < :cutoff")
    int releaseStaleFirstAttempts(@Param("cutoff") Instant cutoff, @Param("now") Instant now);

    /**
     * Same as {@link #releaseStaleFirstAttempts} for retries, which must carry a retry time while PENDING.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRecord p SET p.status = com.paymentengine.payments.PaymentStatus.PENDING, " +
           "p.nextRetryAt = :now, p.updatedAt = :now, p.version = p.version + 1 " +
           "WHERE p.status = com.paymentengine.payments.PaymentStatus.PROCESSING " +
           "AND p.retryCount > 0 AND p.updatedAt < :cutoff")
    int releaseStaleRetries(@Param("cutoff") Instant cutoff, @Param("now") Instant now);
}
