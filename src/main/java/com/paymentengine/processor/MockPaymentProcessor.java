package com.paymentengine.processor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated card processor for development and tests.
 *
 * Behaviour is chosen by the instrument id, in the style of processor test cards:
 * <ul>
 *   <li>{@code pm_card_declined} - declined</li>
 *   <li>{@code pm_insufficient_funds} - insufficient funds</li>
 *   <li>{@code pm_requires_action} - step-up authentication required</li>
 *   <li>{@code pm_processor_down} - processing error</li>
 *   <li>{@code pm_slow} - answers after {@code payment-engine.processor.mock.slow-latency}</li>
 *   <li>anything else - succeeds</li>
 * </ul>
 * A repeated idempotency key replays the first outcome without charging again.
 */
@Component
@Slf4j
public class MockPaymentProcessor implements PaymentProcessorAdapter {

    public static final String DECLINED_INSTRUMENT = "pm_card_declined";
    public static final String INSUFFICIENT_FUNDS_INSTRUMENT = "pm_insufficient_funds";
    public static final String REQUIRES_ACTION_INSTRUMENT = "pm_requires_action";
    public static final String PROCESSOR_DOWN_INSTRUMENT = "pm_processor_down";
    public static final String SLOW_INSTRUMENT = "pm_slow";

    private static final String PROCESSOR_NAME = "MockProcessor";

    private final Map<String, Outcome> outcomesByIdempotencyKey = new ConcurrentHashMap<>();
    private final AtomicInteger chargeCount = new AtomicInteger();
    private final long slowLatencyMs;

    public MockPaymentProcessor(@Value("${payment-engine.processor.mock.slow-latency-ms:30000}") long slowLatencyMs) {
        this.slowLatencyMs = slowLatencyMs;
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        Outcome outcome = outcomesByIdempotencyKey.computeIfAbsent(request.getIdempotencyKey(),
            key -> attempt(request));

        log.info("MockPaymentProcessor: charge payment={}, instrument={}, amount={}, key={}, outcome={}",
            request.getPaymentId(), request.getInstrumentId(), request.getAmount(),
            request.getIdempotencyKey(), outcome.code == null ? "succeeded" : outcome.code);

        if (outcome.code != null) {
            throw new ProcessorException(outcome.code, outcome.message);
        }
        return ChargeResult.succeeded(outcome.reference);
    }

    @Override
    public String getProcessorName() {
        return PROCESSOR_NAME;
    }

    /**
     * Number of distinct charges performed, replays excluded.
     */
    public int getChargeCount() {
        return chargeCount.get();
    }

    private Outcome attempt(ChargeRequest request) {
        String instrument = request.getInstrumentId() == null ? "" : request.getInstrumentId();
        switch (instrument) {
            case DECLINED_INSTRUMENT:
                return Outcome.failure("card_declined", "Your card was declined.");
            case INSUFFICIENT_FUNDS_INSTRUMENT:
                return Outcome.failure("insufficient_funds", "Your card has insufficient funds.");
            case REQUIRES_ACTION_INSTRUMENT:
                return Outcome.failure("authentication_required",
                    "This payment requires additional authentication.");
            case PROCESSOR_DOWN_INSTRUMENT:
                return Outcome.failure("processing_error",
                    "An error occurred while processing your card. Try again later.");
            case SLOW_INSTRUMENT:
                sleep(slowLatencyMs);
                break;
            default:
                break;
        }
        chargeCount.incrementAndGet();
        return Outcome.success("ch_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessorException("timeout", "Charge interrupted", e);
        }
    }

    private static final class Outcome {
        private final String reference;
        private final String code;
        private final String message;

        private Outcome(String reference, String code, String message) {
            this.reference = reference;
            this.code = code;
            this.message = message;
        }

        static Outcome success(String reference) {
            return new Outcome(reference, null, null);
        }

        static Outcome failure(String code, String message) {
            return new Outcome(null, code, message);
        }
    }
}
