package com.paymentengine.ledger;

import com.paymentengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only ledger row. One row per successful charge, payout or refund,
 * linked to the record that produced it. Never updated or deleted.
 */
@Entity
@Table(name = "ledger_transactions", indexes = {
    @Index(name = "idx_ledger_user_id", columnList = "user_id"),
    @Index(name = "idx_ledger_reference", columnList = "reference_type, reference_id"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_ledger_idempotency_key", columnNames = "idempotency_key")
})
@Data
@NoArgsConstructor
public class LedgerTransaction {

    @Id
    private String transactionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransactionType transactionType;

    /**
     * DEBIT takes money from the user, CREDIT gives money to the user.
     */
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EntryType entryType;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", updatable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency", updatable = false))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "reference_type", nullable = false, updatable = false)
    private ReferenceType referenceType;

    @Column(name = "reference_id", nullable = false, updatable = false)
    private String referenceId;

    /**
     * Processor transaction reference, when there is one.
     */
    @Column(updatable = false)
    private String externalReference;

    @Column(updatable = false)
    private String description;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerTransaction(String userId, TransactionType transactionType, EntryType entryType,
                             Money amount, ReferenceType referenceType, String referenceId,
                             String externalReference, String description, String idempotencyKey,
                             Instant createdAt) {
        this.transactionId = UUID.randomUUID().toString();
        this.userId = userId;
        this.transactionType = transactionType;
        this.entryType = entryType;
        this.amount = amount;
        this.referenceType = referenceType;
        this.referenceId = referenceId;
        this.externalReference = externalReference;
        this.description = description;
        this.idempotencyKey = idempotencyKey;
        this.createdAt = createdAt;
    }

    public enum EntryType {
        DEBIT,
        CREDIT
    }
}
