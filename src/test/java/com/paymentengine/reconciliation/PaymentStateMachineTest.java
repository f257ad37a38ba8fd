package com.paymentengine.reconciliation;

import com.paymentengine.common.Currency;
import com.paymentengine.common.Money;
import com.paymentengine.common.exception.InvalidPaymentStateException;
import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentStatus;
import com.paymentengine.processor.ChargeFailureCode;
import com.paymentengine.processor.ChargeResult;
import com.paymentengine.retry.RetryScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the payment lifecycle, without persistence or I/O.
 */
class PaymentStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final PaymentStateMachine stateMachine = new PaymentStateMachine(new RetryScheduler(4));

    @Test
    void testClaimDuePendingRecord() {
        PaymentRecord record = record(PaymentStatus.PENDING, 0);

        PaymentTransition transition = stateMachine.transition(record, PaymentEvent.claim(NOW));

        assertEquals(PaymentStatus.PROCESSING, transition.getStatus());
        assertTrue(transition.getEffects().isEmpty());
        assertEquals(PaymentStatus.PENDING, record.getStatus(), "input record must not change");
    }

    @Test
    void testClaimBeforeRetryTimeIsRejected() {
        PaymentRecord record = record(PaymentStatus.PENDING, 1);
        record.setNextRetryAt(NOW.plus(Duration.ofHours(1)));

        assertFalse(stateMachine.isClaimable(record, NOW));
        assertThrows(InvalidPaymentStateException.class,
            () -> stateMachine.transition(record, PaymentEvent.claim(NOW)));
    }

    @Test
    void testChargeSucceeded() {
        PaymentRecord record = record(PaymentStatus.PROCESSING, 1);
        record.setFailureReason("Your card was declined.");
        record.setFailureCode(ChargeFailureCode.CARD_DECLINED);

        PaymentTransition transition = stateMachine.transition(record,
            PaymentEvent.chargeCompleted(ChargeResult.succeeded("ch_1"), NOW));

        assertEquals(PaymentStatus.SUCCEEDED, transition.getStatus());
        assertEquals(NOW, transition.getChargedAt());
        assertEquals("ch_1", transition.getExternalTransactionReference());
        assertNull(transition.getFailureReason());
        assertNull(transition.getFailureCode());
        assertNull(transition.getNextRetryAt());
        assertEquals(List.of(PaymentEffect.RECORD_LEDGER_PAYMENT), transition.getEffects());
    }

    @Test
    void testRetryableFailureSchedulesRetry() {
        PaymentRecord record = record(PaymentStatus.PROCESSING, 1);

        PaymentTransition transition = stateMachine.transition(record, declined());

        assertEquals(PaymentStatus.PENDING, transition.getStatus());
        assertEquals(2, transition.getRetryCount());
        assertEquals(NOW.plus(Duration.ofHours(4)), transition.getNextRetryAt());
        assertEquals(ChargeFailureCode.CARD_DECLINED, transition.getFailureCode());
        assertEquals(List.of(PaymentEffect.NOTIFY_RETRY_SCHEDULED), transition.getEffects());
    }

    @Test
    void testLastRetryableFailureFailsAndPauses() {
        PaymentRecord record = record(PaymentStatus.PROCESSING, 2);

        PaymentTransition transition = stateMachine.transition(record, declined());

        assertEquals(PaymentStatus.FAILED, transition.getStatus());
        assertEquals(2, transition.getRetryCount());
        assertNull(transition.getNextRetryAt());
        assertTrue(transition.hasEffect(PaymentEffect.NOTIFY_PERMANENT_FAILURE));
        assertTrue(transition.hasEffect(PaymentEffect.PAUSE_AGREEMENT));
    }

    @Test
    void testAuthenticationRequiredFailsWithoutConsumingRetry() {
        PaymentRecord record = record(PaymentStatus.PROCESSING, 0);
        ChargeResult result = ChargeResult.failed(ChargeFailureCode.AUTHENTICATION_REQUIRED, "3DS needed");

        PaymentTransition transition = stateMachine.transition(record, PaymentEvent.chargeCompleted(result, NOW));

        assertEquals(PaymentStatus.FAILED, transition.getStatus());
        assertEquals(0, transition.getRetryCount());
        assertNull(transition.getNextRetryAt());
        assertEquals(List.of(PaymentEffect.NOTIFY_ACTION_REQUIRED), transition.getEffects());
    }

    @Test
    void testChargeOutcomeOnlyFromProcessing() {
        PaymentRecord record = record(PaymentStatus.PENDING, 0);

        assertThrows(InvalidPaymentStateException.class,
            () -> stateMachine.transition(record, PaymentEvent.chargeCompleted(ChargeResult.succeeded("ch_1"), NOW)));
        assertThrows(InvalidPaymentStateException.class,
            () -> stateMachine.transition(record, declined()));
    }

    @Test
    void testManualRetryResetsBudgetAndCountsRequest() {
        PaymentRecord record = record(PaymentStatus.FAILED, 2);

        PaymentTransition transition = stateMachine.transition(record, PaymentEvent.manualRetry(NOW));

        assertEquals(PaymentStatus.PENDING, transition.getStatus());
        assertEquals(0, transition.getRetryCount());
        assertNull(transition.getNextRetryAt());
        assertEquals(1, transition.getManualRetryCount());
    }

    @Test
    void testManualRetryRejectedOnSucceededPayment() {
        PaymentRecord record = record(PaymentStatus.SUCCEEDED, 0);

        assertThrows(InvalidPaymentStateException.class,
            () -> stateMachine.transition(record, PaymentEvent.manualRetry(NOW)));
    }

    @Test
    void testCancel() {
        PaymentRecord pending = record(PaymentStatus.PENDING, 1);
        pending.setNextRetryAt(NOW.plus(Duration.ofHours(4)));

        PaymentTransition transition = stateMachine.transition(pending, PaymentEvent.cancel(NOW));

        assertEquals(PaymentStatus.CANCELLED, transition.getStatus());
        assertNull(transition.getNextRetryAt());
        assertTrue(transition.isChanged());
    }

    @Test
    void testCancelIsNoOpWhenAlreadyCancelled() {
        PaymentRecord cancelled = record(PaymentStatus.CANCELLED, 0);

        PaymentTransition transition = stateMachine.transition(cancelled, PaymentEvent.cancel(NOW));

        assertFalse(transition.isChanged());
        assertEquals(PaymentStatus.CANCELLED, transition.getStatus());
    }

    @Test
    void testCancelRejectedWhileProcessingOrSucceeded() {
        assertThrows(InvalidPaymentStateException.class,
            () -> stateMachine.transition(record(PaymentStatus.PROCESSING, 0), PaymentEvent.cancel(NOW)));
        assertThrows(InvalidPaymentStateException.class,
            () -> stateMachine.transition(record(PaymentStatus.SUCCEEDED, 0), PaymentEvent.cancel(NOW)));
    }

    @Test
    void testRetryCountNeverExceedsMaxRetries() {
        PaymentRecord record = record(PaymentStatus.PROCESSING, 0);
        Instant at = NOW;

        for (int attempt = 0; attempt < 10 && record.getStatus() == PaymentStatus.PROCESSING; attempt++) {
            PaymentTransition transition = stateMachine.transition(record, PaymentEvent.chargeCompleted(
                ChargeResult.failed(ChargeFailureCode.PROCESSOR_UNAVAILABLE, "down"), at));
            record.apply(transition, at);
            assertTrue(record.getRetryCount() <= record.getMaxRetries());
            if (record.getStatus() == PaymentStatus.PENDING) {
                at = record.getNextRetryAt();
                record.apply(stateMachine.transition(record, PaymentEvent.claim(at)), at);
            }
        }

        assertEquals(PaymentStatus.FAILED, record.getStatus());
    }

    private PaymentEvent declined() {
        return PaymentEvent.chargeCompleted(
            ChargeResult.failed(ChargeFailureCode.CARD_DECLINED, "Your card was declined."), NOW);
    }

    private PaymentRecord record(PaymentStatus status, int retryCount) {
        PaymentRecord record = new PaymentRecord("agreement-1", "payer-1", "pm_card_visa",
            Money.of("25.00", Currency.USD), 3, NOW.minus(Duration.ofDays(1)));
        record.setStatus(status);
        record.setRetryCount(retryCount);
        return record;
    }
}
