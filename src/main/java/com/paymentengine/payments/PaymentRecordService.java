package com.paymentengine.payments;

import com.paymentengine.common.Money;
import com.paymentengine.common.exception.PaymentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for payment records.
 *
 * Writes go through {@link #claimForProcessing} (compare-and-swap on status) or
 * {@link #save} (optimistic lock on the version column). There is no unguarded
 * read-modify-write path.
 */
@Service
@Slf4j
public class PaymentRecordService {

    private final PaymentRecordRepository paymentRecordRepository;
    private final Clock clock;
    private final int maxRetries;

    public PaymentRecordService(PaymentRecordRepository paymentRecordRepository,
                                Clock clock,
                                @Value("${payment-engine.retry.max-retries:3}") int maxRetries) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    @Transactional
    public PaymentRecord create(String agreementId, String payerId, String instrumentId, Money amount) {
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Payment amount must be positive: " + amount);
        }
        PaymentRecord record = new PaymentRecord(agreementId, payerId, instrumentId, amount,
            maxRetries, clock.instant());
        paymentRecordRepository.save(record);

        log.info("Created payment {} for agreement {} payer {} amount {}",
            record.getPaymentId(), agreementId, payerId, amount);

        return record;
    }

    @Transactional(readOnly = true)
    public PaymentRecord get(String paymentId) {
        return paymentRecordRepository.findById(paymentId)
            .orElseThrow(() -> new PaymentNotFoundException(paymentId));
    }

    @Transactional(readOnly = true)
    public List<PaymentRecord> listDue(Instant now) {
        return paymentRecordRepository.findDue(now);
    }

    @Transactional(readOnly = true)
    public List<PaymentRecord> listByAgreement(String agreementId) {
        return paymentRecordRepository.findByAgreementIdOrderByCreatedAtDesc(agreementId);
    }

    /**
     * Move a PENDING record due at {@code now} to PROCESSING. Empty when another worker
     * won the race or the record is not due; neither case is an error.
     * The claim is stamped with the clock, not with {@code now}; the stale-claim
     * sweep measures from that stamp.
     */
    @Transactional
    public Optional<PaymentRecord> claimForProcessing(String paymentId, Instant now) {
        int updated = paymentRecordRepository.claimForProcessing(paymentId, now, clock.instant());
        if (updated == 0) {
            log.debug("Payment {} not claimed: not due, not pending, or claimed elsewhere", paymentId);
            return Optional.empty();
        }
        return paymentRecordRepository.findById(paymentId);
    }

    /**
     * Hand claims abandoned by a crashed worker back to the due queue.
     */
    @Transactional
    public int releaseStaleClaims(Instant cutoff, Instant now) {
        int released = paymentRecordRepository.releaseStaleFirstAttempts(cutoff, now)
            + paymentRecordRepository.releaseStaleRetries(cutoff, now);
        if (released > 0) {
            log.warn("Released {} payments stuck in PROCESSING since before {}", released, cutoff);
        }
        return released;
    }

    @Transactional
    public PaymentRecord save(PaymentRecord record) {
        return paymentRecordRepository.save(record);
    }

    /**
     * Point every PENDING record of an agreement at a new instrument.
     */
    @Transactional
    public int updatePaymentMethod(String agreementId, String instrumentId) {
        List<PaymentRecord> pending = paymentRecordRepository
            .findByAgreementIdAndStatus(agreementId, PaymentStatus.PENDING);
        Instant now = clock.instant();
        pending.forEach(record -> record.changeInstrument(instrumentId, now));
        paymentRecordRepository.saveAll(pending);

        log.info("Moved {} pending payments of agreement {} to instrument {}",
            pending.size(), agreementId, instrumentId);
        return pending.size();
    }

    @Transactional(readOnly = true)
    public PaymentStats getStats(String payerId) {
        List<PaymentRecord> records = paymentRecordRepository.findByPayerId(payerId);

        BigDecimal totalPaid = sum(records, PaymentStatus.SUCCEEDED);
        BigDecimal totalPending = sum(records, PaymentStatus.PENDING);
        BigDecimal totalFailed = sum(records, PaymentStatus.FAILED);

        long succeeded = count(records, PaymentStatus.SUCCEEDED);
        long settled = succeeded + count(records, PaymentStatus.FAILED);
        BigDecimal successRate = settled == 0
            ? BigDecimal.ZERO.setScale(2)
            : BigDecimal.valueOf(succeeded * 100).divide(BigDecimal.valueOf(settled), 2, RoundingMode.HALF_UP);

        return PaymentStats.builder()
            .totalPaid(totalPaid)
            .totalPending(totalPending)
            .totalFailed(totalFailed)
            .successRate(successRate)
            .build();
    }

    private static BigDecimal sum(List<PaymentRecord> records, PaymentStatus status) {
        return records.stream()
            .filter(r -> r.getStatus() == status)
            .map(r -> r.getAmount().getAmount())
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
    }

    private static long count(List<PaymentRecord> records, PaymentStatus status) {
        return records.stream().filter(r -> r.getStatus() == status).count();
    }
}
