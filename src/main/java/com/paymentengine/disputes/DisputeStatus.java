package com.paymentengine.disputes;

public enum DisputeStatus {
    OPEN,
    UNDER_REVIEW,
    INVESTIGATION_REQUIRED,
    PENDING_RESOLUTION,
    RESOLVED,
    CLOSED,
    APPEALED
}
