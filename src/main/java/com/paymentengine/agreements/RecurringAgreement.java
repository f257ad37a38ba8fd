package com.paymentengine.agreements;

import com.paymentengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A customer's standing instruction to be billed for a provider's service on a
 * fixed frequency. Each billing cycle opens one {@code PaymentRecord}.
 */
@Entity
@Table(name = "recurring_agreements", indexes = {
    @Index(name = "idx_agreement_customer_id", columnList = "customer_id"),
    @Index(name = "idx_agreement_active_next_billing", columnList = "active, next_billing_date")
})
@Data
@NoArgsConstructor
public class RecurringAgreement {

    @Id
    private String agreementId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private String customerId;

    @Column(nullable = false, updatable = false)
    private String providerId;

    @Column(nullable = false)
    private String instrumentId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "currency"))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BillingFrequency frequency;

    @Column(name = "next_billing_date", nullable = false)
    private LocalDate nextBillingDate;

    private boolean active;

    private Instant pausedAt;

    private String pauseReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public RecurringAgreement(String customerId, String providerId, String instrumentId, Money amount,
                              BillingFrequency frequency, LocalDate firstBillingDate, Instant createdAt) {
        this.agreementId = UUID.randomUUID().toString();
        this.customerId = customerId;
        this.providerId = providerId;
        this.instrumentId = instrumentId;
        this.amount = amount;
        this.frequency = frequency;
        this.nextBillingDate = firstBillingDate;
        this.active = true;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void pause(String reason, Instant now) {
        this.active = false;
        this.pausedAt = now;
        this.pauseReason = reason;
        this.updatedAt = now;
    }

    public void resume(Instant now) {
        this.active = true;
        this.pausedAt = null;
        this.pauseReason = null;
        this.updatedAt = now;
    }

    public void advanceBillingDate(Instant now) {
        this.nextBillingDate = frequency.next(nextBillingDate);
        this.updatedAt = now;
    }
}
