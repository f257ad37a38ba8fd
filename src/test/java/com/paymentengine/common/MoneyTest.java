package com.paymentengine.common;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    void testScaleIsAlwaysTwo() {
        assertEquals(new BigDecimal("10.00"), Money.of("10", Currency.USD).getAmount());
        assertEquals(new BigDecimal("10.13"), Money.of("10.125", Currency.USD).getAmount());
    }

    @Test
    void testPercentage() {
        Money price = Money.of("80.00", Currency.USD);

        assertEquals(Money.of("80.00", Currency.USD), price.percentage(100));
        assertEquals(Money.of("20.00", Currency.USD), price.percentage(25));
        assertTrue(price.percentage(0).isZero());
        assertThrows(IllegalArgumentException.class, () -> price.percentage(101));
    }

    @Test
    void testRequiresAmountAndCurrency() {
        assertThrows(IllegalArgumentException.class, () -> Money.of((BigDecimal) null, Currency.USD));
        assertThrows(IllegalArgumentException.class, () -> Money.of("1.00", null));
    }
}
