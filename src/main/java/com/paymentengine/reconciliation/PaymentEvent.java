package com.paymentengine.reconciliation;

import com.paymentengine.processor.ChargeResult;
import lombok.Value;

import java.time.Instant;

/**
 * Something that happened to a payment record. Charge events carry the classified result.
 */
@Value
public class PaymentEvent {

    PaymentEventType type;
    ChargeResult chargeResult;
    Instant at;

    public static PaymentEvent claim(Instant at) {
        return new PaymentEvent(PaymentEventType.CLAIM, null, at);
    }

    public static PaymentEvent chargeCompleted(ChargeResult result, Instant at) {
        PaymentEventType type = result.isSucceeded()
            ? PaymentEventType.CHARGE_SUCCEEDED
            : PaymentEventType.CHARGE_FAILED;
        return new PaymentEvent(type, result, at);
    }

    public static PaymentEvent manualRetry(Instant at) {
        return new PaymentEvent(PaymentEventType.MANUAL_RETRY, null, at);
    }

    public static PaymentEvent cancel(Instant at) {
        return new PaymentEvent(PaymentEventType.CANCEL, null, at);
    }
}
