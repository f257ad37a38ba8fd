package com.paymentengine.notifications;

public enum NotificationType {
    PAYMENT_RETRY_SCHEDULED,
    PAYMENT_FAILED,
    PAYMENT_ACTION_REQUIRED,
    EARLY_PAYOUT_COMPLETED,
    REFUND_ISSUED
}
