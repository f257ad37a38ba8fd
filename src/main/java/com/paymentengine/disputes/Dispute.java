package com.paymentengine.disputes;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "disputes", indexes = {
    @Index(name = "idx_dispute_booking_id", columnList = "booking_id")
})
@Data
@NoArgsConstructor
public class Dispute {

    @Id
    private String disputeId;

    @Column(name = "booking_id", nullable = false, updatable = false)
    private String bookingId;

    @Column(nullable = false, updatable = false)
    private String raisedBy;

    @Column(length = 1000)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DisputeStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Dispute(String bookingId, String raisedBy, String reason, Instant createdAt) {
        this.disputeId = UUID.randomUUID().toString();
        this.bookingId = bookingId;
        this.raisedBy = raisedBy;
        this.reason = reason;
        this.status = DisputeStatus.OPEN;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }
}
