package com.paymentengine.escrow;

import com.paymentengine.bookings.BookingType;
import com.paymentengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * When a provider gets paid for a completed booking, and whether they asked to be
 * paid early.
 */
@Entity
@Table(name = "payout_schedules", indexes = {
    @Index(name = "idx_payout_provider_id", columnList = "provider_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_payout_booking_id", columnNames = "booking_id")
})
@Data
@NoArgsConstructor
public class PayoutSchedule {

    @Id
    private String scheduleId;

    @Column(name = "booking_id", nullable = false, updatable = false)
    private String bookingId;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private String providerId;

    @Column(nullable = false, updatable = false)
    private String escrowHoldId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private BookingType bookingType;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "payout_amount", updatable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "payout_currency", updatable = false))
    })
    private Money payoutAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PayoutStatus status;

    private Instant bookingCompletedAt;

    private Instant eligibleForPayoutAt;

    private LocalDate scheduledPayoutDate;

    private Instant earlyPayoutEligibleAt;

    private boolean earlyPayoutRequested;

    private Instant requestedAt;

    private Instant processedAt;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PayoutSchedule(String bookingId, String providerId, String escrowHoldId, BookingType bookingType,
                          Money payoutAmount, Instant bookingCompletedAt, Instant eligibleForPayoutAt,
                          LocalDate scheduledPayoutDate,
                          Instant earlyPayoutEligibleAt, Instant createdAt) {
        this.scheduleId = UUID.randomUUID().toString();
        this.bookingId = bookingId;
        this.providerId = providerId;
        this.escrowHoldId = escrowHoldId;
        this.bookingType = bookingType;
        this.payoutAmount = payoutAmount;
        this.status = PayoutStatus.PENDING;
        this.bookingCompletedAt = bookingCompletedAt;
        this.eligibleForPayoutAt = eligibleForPayoutAt;
        this.scheduledPayoutDate = scheduledPayoutDate;
        this.earlyPayoutEligibleAt = earlyPayoutEligibleAt;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean isEarlyPayoutEligible(Instant now) {
        return !now.isBefore(earlyPayoutEligibleAt);
    }

    public void markEarlyPayoutRequested(Instant now) {
        this.earlyPayoutRequested = true;
        this.requestedAt = now;
        this.status = PayoutStatus.PROCESSING;
        this.updatedAt = now;
    }

    /**
     * Undo an early payout request so the schedule falls back to its regular date.
     */
    public void revertEarlyPayoutRequest(Instant now) {
        this.earlyPayoutRequested = false;
        this.requestedAt = null;
        this.status = PayoutStatus.PENDING;
        this.updatedAt = now;
    }

    public void complete(Instant now) {
        this.status = PayoutStatus.COMPLETED;
        this.processedAt = now;
        this.updatedAt = now;
    }
}
