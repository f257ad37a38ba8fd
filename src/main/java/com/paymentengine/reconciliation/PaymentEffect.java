package com.paymentengine.reconciliation;

/**
 * Side effects a transition asks for. The state machine only names them;
 * {@link PaymentTransitionService} carries them out.
 */
public enum PaymentEffect {
    RECORD_LEDGER_PAYMENT,
    NOTIFY_RETRY_SCHEDULED,
    NOTIFY_ACTION_REQUIRED,
    NOTIFY_PERMANENT_FAILURE,
    PAUSE_AGREEMENT
}
