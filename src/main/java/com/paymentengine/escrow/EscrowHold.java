package com.paymentengine.escrow;

import com.paymentengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Customer funds held by the platform for one booking until they are paid out to
 * the provider or refunded to the customer. Leaves HELD at most once.
 */
@Entity
@Table(name = "escrow_holds", uniqueConstraints = {
    @UniqueConstraint(name = "uk_escrow_booking_id", columnNames = "booking_id")
})
@Data
@NoArgsConstructor
public class EscrowHold {

    @Id
    private String escrowHoldId;

    @Column(name = "booking_id", nullable = false, updatable = false)
    private String bookingId;

    @Column(nullable = false, updatable = false)
    private String customerId;

    @Column(nullable = false, updatable = false)
    private String providerId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", updatable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency", updatable = false))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EscrowHoldStatus status;

    private Instant heldAt;

    private Instant expiresAt;

    private Instant releasedAt;

    private Instant refundedAt;

    @Version
    private long version;

    public EscrowHold(String bookingId, String customerId, String providerId, Money amount,
                      Instant heldAt, Instant expiresAt) {
        this.escrowHoldId = UUID.randomUUID().toString();
        this.bookingId = bookingId;
        this.customerId = customerId;
        this.providerId = providerId;
        this.amount = amount;
        this.status = EscrowHoldStatus.HELD;
        this.heldAt = heldAt;
        this.expiresAt = expiresAt;
    }

    public boolean isHeld() {
        return status == EscrowHoldStatus.HELD;
    }

    public void release(Instant now) {
        requireHeld();
        this.status = EscrowHoldStatus.RELEASED;
        this.releasedAt = now;
    }

    public void refund(Instant now) {
        requireHeld();
        this.status = EscrowHoldStatus.REFUNDED;
        this.refundedAt = now;
    }

    private void requireHeld() {
        if (!isHeld()) {
            throw new IllegalStateException("Escrow hold " + escrowHoldId + " is " + status + ", not HELD");
        }
    }
}
