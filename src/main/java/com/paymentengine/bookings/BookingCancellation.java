package com.paymentengine.bookings;

import com.paymentengine.common.Money;
import com.paymentengine.refunds.CancellingParty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit row for a cancelled booking and the refund it qualified for at the time.
 */
@Entity
@Table(name = "booking_cancellations")
@Data
@NoArgsConstructor
public class BookingCancellation {

    @Id
    private String cancellationId;

    @Column(name = "booking_id", nullable = false, updatable = false, unique = true)
    private String bookingId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CancellingParty cancelledBy;

    private String reason;

    private int refundPercentage;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "refund_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "refund_currency"))
    })
    private Money refundAmount;

    private String refundId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public BookingCancellation(String bookingId, CancellingParty cancelledBy, String reason,
                               int refundPercentage, Money refundAmount, String refundId, Instant createdAt) {
        this.cancellationId = UUID.randomUUID().toString();
        this.bookingId = bookingId;
        this.cancelledBy = cancelledBy;
        this.reason = reason;
        this.refundPercentage = refundPercentage;
        this.refundAmount = refundAmount;
        this.refundId = refundId;
        this.createdAt = createdAt;
    }
}
