package com.paymentengine.refunds;

import com.paymentengine.common.Currency;
import com.paymentengine.common.Money;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the cancellation refund policy.
 */
class RefundEligibilityEngineTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final Money PRICE = Money.of("200.00", Currency.USD);

    private final RefundEligibilityEngine engine = new RefundEligibilityEngine();

    @Test
    void testCustomerCancelsTenDaysOut_FullRefund() {
        RefundEligibility result = engine.evaluate(TODAY.plusDays(10), CancellingParty.CUSTOMER, PRICE, TODAY);

        assertTrue(result.isEligible());
        assertEquals(100, result.getRefundPercentage());
        assertEquals(Money.of("200.00", Currency.USD), result.getRefundAmount());
        assertEquals(10, result.getDaysUntilService());
        assertNull(result.getReason());
    }

    @Test
    void testCustomerCancelsTwoDaysOut_QuarterRefund() {
        RefundEligibility result = engine.evaluate(TODAY.plusDays(2), CancellingParty.CUSTOMER, PRICE, TODAY);

        assertTrue(result.isEligible());
        assertEquals(25, result.getRefundPercentage());
        assertEquals(Money.of("50.00", Currency.USD), result.getRefundAmount());
        assertEquals(RefundEligibilityEngine.QUARTER_POLICY, result.getPolicy());
    }

    @Test
    void testCustomerCancelsSameDay_NoRefund() {
        RefundEligibility result = engine.evaluate(TODAY, CancellingParty.CUSTOMER, PRICE, TODAY);

        assertFalse(result.isEligible());
        assertEquals(0, result.getRefundPercentage());
        assertTrue(result.getRefundAmount().isZero());
        assertEquals("No refund — cancelling within 24 hours of service", result.getReason());
    }

    @Test
    void testCustomerCancelsAfterServiceDate_NoRefund() {
        RefundEligibility result = engine.evaluate(TODAY.minusDays(1), CancellingParty.CUSTOMER, PRICE, TODAY);

        assertFalse(result.isEligible());
        assertEquals(-1, result.getDaysUntilService());
    }

    @Test
    void testTierBoundaries() {
        assertEquals(100, percentageAt(7));
        assertEquals(50, percentageAt(6));
        assertEquals(50, percentageAt(3));
        assertEquals(25, percentageAt(1));
        assertEquals(0, percentageAt(0));
    }

    @Test
    void testProviderCancels_FullRefundRegardlessOfTiming() {
        for (int days : new int[] {-2, 0, 1, 5, 30}) {
            RefundEligibility result = engine.evaluate(TODAY.plusDays(days), CancellingParty.PROVIDER, PRICE, TODAY);

            assertTrue(result.isEligible());
            assertEquals(100, result.getRefundPercentage());
            assertEquals(PRICE, result.getRefundAmount());
            assertEquals(RefundEligibilityEngine.PROVIDER_POLICY, result.getPolicy());
        }
    }

    @Test
    void testRefundAmountRoundsHalfUp() {
        Money odd = Money.of("33.33", Currency.USD);

        RefundEligibility half = engine.evaluate(TODAY.plusDays(4), CancellingParty.CUSTOMER, odd, TODAY);
        RefundEligibility quarter = engine.evaluate(TODAY.plusDays(1), CancellingParty.CUSTOMER, odd, TODAY);

        assertEquals(Money.of("16.67", Currency.USD), half.getRefundAmount());
        assertEquals(Money.of("8.33", Currency.USD), quarter.getRefundAmount());
    }

    @Test
    void testSameInputsSameResult() {
        RefundEligibility first = engine.evaluate(TODAY.plusDays(4), CancellingParty.CUSTOMER, PRICE, TODAY);
        RefundEligibility second = engine.evaluate(TODAY.plusDays(4), CancellingParty.CUSTOMER, PRICE, TODAY);

        assertEquals(first, second);
    }

    private int percentageAt(int daysOut) {
        return engine.evaluate(TODAY.plusDays(daysOut), CancellingParty.CUSTOMER, PRICE, TODAY).getRefundPercentage();
    }
}
