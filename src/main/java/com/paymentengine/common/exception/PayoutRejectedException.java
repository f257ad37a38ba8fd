package com.paymentengine.common.exception;

/**
 * Thrown when a payout request fails one of its preconditions.
 * No state has been changed when this is raised.
 */
public class PayoutRejectedException extends PaymentEngineException {

    private final String scheduleId;

    public PayoutRejectedException(String scheduleId, String reason) {
        super(String.format("Payout %s rejected: %s", scheduleId, reason));
        this.scheduleId = scheduleId;
    }

    public String getScheduleId() {
        return scheduleId;
    }
}
