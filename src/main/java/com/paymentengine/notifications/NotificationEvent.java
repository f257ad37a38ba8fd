package com.paymentengine.notifications;

import lombok.Value;

/**
 * Request to notify a user, published as a Spring application event and
 * delivered once the publishing transaction has committed.
 */
@Value
public class NotificationEvent {
    String userId;
    String title;
    String message;
    NotificationType type;
    String referenceId;
}
