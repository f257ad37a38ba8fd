package com.paymentengine.notifications;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A message delivered to a user's in-app inbox.
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notification_user_id", columnList = "user_id"),
    @Index(name = "idx_notification_reference_id", columnList = "reference_id")
})
@Data
@NoArgsConstructor
public class Notification {

    @Id
    private String notificationId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    private String title;

    @Column(length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    private NotificationType type;

    @Column(name = "reference_id")
    private String referenceId;

    @Column(name = "is_read")
    private boolean read;

    @Column(name = "created_at")
    private Instant createdAt;

    public Notification(String userId, String title, String message, NotificationType type,
                        String referenceId, Instant createdAt) {
        this.notificationId = UUID.randomUUID().toString();
        this.userId = userId;
        this.title = title;
        this.message = message;
        this.type = type;
        this.referenceId = referenceId;
        this.createdAt = createdAt;
    }
}
