package com.paymentengine.bookings;

import com.paymentengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * The parts of a marketplace booking that money movement depends on.
 */
@Entity
@Table(name = "bookings", indexes = {
    @Index(name = "idx_booking_customer_id", columnList = "customer_id"),
    @Index(name = "idx_booking_provider_id", columnList = "provider_id")
})
@Data
@NoArgsConstructor
public class Booking {

    @Id
    private String bookingId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private String customerId;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BookingType bookingType;

    @Column(nullable = false)
    private LocalDate scheduledDate;

    private LocalTime scheduledTime;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "price_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "price_currency"))
    })
    private Money price;

    /**
     * Price net of platform fees.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "payout_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "payout_currency"))
    })
    private Money providerPayout;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BookingEscrowStatus escrowStatus;

    private Instant completedAt;

    private Instant cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Booking(String customerId, String providerId, BookingType bookingType,
                   LocalDate scheduledDate, LocalTime scheduledTime,
                   Money price, Money providerPayout, Instant createdAt) {
        this.bookingId = UUID.randomUUID().toString();
        this.customerId = customerId;
        this.providerId = providerId;
        this.bookingType = bookingType;
        this.scheduledDate = scheduledDate;
        this.scheduledTime = scheduledTime;
        this.price = price;
        this.providerPayout = providerPayout;
        this.status = BookingStatus.CONFIRMED;
        this.escrowStatus = BookingEscrowStatus.NONE;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean isClosed() {
        return status == BookingStatus.COMPLETED || status == BookingStatus.CANCELLED;
    }

    public void changeEscrowStatus(BookingEscrowStatus escrowStatus, Instant now) {
        this.escrowStatus = escrowStatus;
        this.updatedAt = now;
    }
}
