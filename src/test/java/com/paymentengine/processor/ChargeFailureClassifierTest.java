package com.paymentengine.processor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChargeFailureClassifierTest {

    private final ChargeFailureClassifier classifier = new ChargeFailureClassifier();

    @Test
    void testCardLevelCodes() {
        assertEquals(ChargeFailureCode.CARD_DECLINED, classifier.classify("card_declined"));
        assertEquals(ChargeFailureCode.CARD_DECLINED, classifier.classify("expired_card"));
        assertEquals(ChargeFailureCode.CARD_DECLINED, classifier.classify("do_not_honor_decline"));
        assertEquals(ChargeFailureCode.INSUFFICIENT_FUNDS, classifier.classify("insufficient_funds"));
    }

    @Test
    void testAuthenticationCodes() {
        assertEquals(ChargeFailureCode.AUTHENTICATION_REQUIRED, classifier.classify("authentication_required"));
        assertEquals(ChargeFailureCode.AUTHENTICATION_REQUIRED, classifier.classify("requires_action"));
        assertFalse(ChargeFailureCode.AUTHENTICATION_REQUIRED.isRetryable());
    }

    @Test
    void testProcessorSideAndUnknownCodes() {
        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, classifier.classify("processing_error"));
        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, classifier.classify("rate_limit"));
        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, classifier.classify("something_new"));
        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, classifier.classify(null));
        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, classifier.classify("  "));
    }

    @Test
    void testOnlyCardLevelReasonsAreShownToPayer() {
        assertTrue(ChargeFailureCode.CARD_DECLINED.isShownToPayer());
        assertTrue(ChargeFailureCode.INSUFFICIENT_FUNDS.isShownToPayer());
        assertFalse(ChargeFailureCode.PROCESSOR_UNAVAILABLE.isShownToPayer());
    }
}
