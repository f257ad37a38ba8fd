package com.paymentengine.payments;

import com.paymentengine.common.Money;
import com.paymentengine.processor.ChargeFailureCode;
import com.paymentengine.reconciliation.PaymentTransition;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One tracked charge for a recurring agreement's billing cycle.
 *
 * Only the reconciliation layer changes a record, always through a
 * {@link PaymentTransition}. Records are never deleted.
 */
@Entity
@Table(name = "payment_records", indexes = {
    @Index(name = "idx_payment_agreement_id", columnList = "agreement_id"),
    @Index(name = "idx_payment_payer_id", columnList = "payer_id"),
    @Index(name = "idx_payment_status_next_retry", columnList = "status, next_retry_at")
})
@Data
@NoArgsConstructor
public class PaymentRecord {

    @Id
    private String paymentId;

    @Column(name = "agreement_id", nullable = false, updatable = false)
    private String agreementId;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private String payerId;

    private String instrumentId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", updatable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency", updatable = false))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus status;

    private int retryCount;

    private int maxRetries;

    /**
     * Manual "retry now" requests. Kept because a manual retry resets retryCount.
     */
    private int manualRetryCount;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    private String failureReason;

    @Enumerated(EnumType.STRING)
    private ChargeFailureCode failureCode;

    private Instant chargedAt;

    private String externalTransactionReference;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PaymentRecord(String agreementId, String payerId, String instrumentId,
                         Money amount, int maxRetries, Instant createdAt) {
        this.paymentId = UUID.randomUUID().toString();
        this.agreementId = agreementId;
        this.payerId = payerId;
        this.instrumentId = instrumentId;
        this.amount = amount;
        this.status = PaymentStatus.PENDING;
        this.retryCount = 0;
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void apply(PaymentTransition transition, Instant now) {
        this.status = transition.getStatus();
        this.retryCount = transition.getRetryCount();
        this.manualRetryCount = transition.getManualRetryCount();
        this.nextRetryAt = transition.getNextRetryAt();
        this.failureReason = transition.getFailureReason();
        this.failureCode = transition.getFailureCode();
        this.chargedAt = transition.getChargedAt();
        this.externalTransactionReference = transition.getExternalTransactionReference();
        this.updatedAt = now;
    }

    public void changeInstrument(String instrumentId, Instant now) {
        this.instrumentId = instrumentId;
        this.updatedAt = now;
    }

    public boolean isDue(Instant now) {
        return status == PaymentStatus.PENDING && (nextRetryAt == null || !nextRetryAt.isAfter(now));
    }
}
