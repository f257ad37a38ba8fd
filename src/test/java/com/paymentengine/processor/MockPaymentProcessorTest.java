package com.paymentengine.processor;

import com.paymentengine.common.Currency;
import com.paymentengine.common.IdempotencyKey;
import com.paymentengine.common.Money;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MockPaymentProcessorTest {

    private final MockPaymentProcessor processor = new MockPaymentProcessor(50);

    @Test
    void testRepeatedKeyReplaysFirstCharge() {
        ChargeRequest request = request("pm_card_visa", IdempotencyKey.forChargeAttempt("p-1", 0, 0));

        ChargeResult first = processor.charge(request);
        ChargeResult replay = processor.charge(request);

        assertTrue(first.isSucceeded());
        assertEquals(first.getExternalReference(), replay.getExternalReference());
        assertEquals(1, processor.getChargeCount());
    }

    @Test
    void testNewAttemptKeyChargesAgain() {
        processor.charge(request("pm_card_visa", IdempotencyKey.forChargeAttempt("p-1", 0, 0)));
        processor.charge(request("pm_card_visa", IdempotencyKey.forChargeAttempt("p-1", 1, 0)));

        assertEquals(2, processor.getChargeCount());
    }

    @Test
    void testDeclinedInstrumentThrowsProviderCode() {
        ProcessorException e = assertThrows(ProcessorException.class, () ->
            processor.charge(request(MockPaymentProcessor.DECLINED_INSTRUMENT, IdempotencyKey.generate())));

        assertEquals("card_declined", e.getProcessorCode());
        assertEquals(0, processor.getChargeCount());
    }

    @Test
    void testRequiresActionInstrument() {
        ProcessorException e = assertThrows(ProcessorException.class, () ->
            processor.charge(request(MockPaymentProcessor.REQUIRES_ACTION_INSTRUMENT, IdempotencyKey.generate())));

        assertEquals("authentication_required", e.getProcessorCode());
    }

    private ChargeRequest request(String instrumentId, String key) {
        return ChargeRequest.builder()
            .paymentId("p-1")
            .payerId("payer-1")
            .instrumentId(instrumentId)
            .amount(Money.of("10.00", Currency.USD))
            .idempotencyKey(key)
            .build();
    }
}
