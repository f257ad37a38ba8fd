package com.paymentengine.refunds;

import com.paymentengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A refund owed to a customer for a cancelled booking. At most one per booking.
 */
@Entity
@Table(name = "refunds", uniqueConstraints = {
    @UniqueConstraint(name = "uk_refund_booking_id", columnNames = "booking_id")
})
@Data
@NoArgsConstructor
public class Refund {

    @Id
    private String refundId;

    @Column(name = "booking_id", nullable = false, updatable = false)
    private String bookingId;

    @Column(nullable = false, updatable = false)
    private String customerId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", updatable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency", updatable = false))
    })
    private Money amount;

    private int refundPercentage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RefundStatus status;

    @Enumerated(EnumType.STRING)
    private CancellingParty cancelledBy;

    private String policy;

    private String reason;

    @Column(length = 1000)
    private String notes;

    private String requestedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Instant processedAt;

    public Refund(String bookingId, String customerId, RefundEligibility eligibility,
                  CancellingParty cancelledBy, String reason, String notes, String requestedBy,
                  Instant createdAt) {
        this.refundId = UUID.randomUUID().toString();
        this.bookingId = bookingId;
        this.customerId = customerId;
        this.amount = eligibility.getRefundAmount();
        this.refundPercentage = eligibility.getRefundPercentage();
        this.policy = eligibility.getPolicy();
        this.status = RefundStatus.PENDING;
        this.cancelledBy = cancelledBy;
        this.reason = reason;
        this.notes = notes;
        this.requestedBy = requestedBy;
        this.createdAt = createdAt;
    }
}
