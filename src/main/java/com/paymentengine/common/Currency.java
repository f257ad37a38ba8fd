package com.paymentengine.common;

/**
 * Currencies the marketplace bills in. Records carry the currency they were
 * created with and never convert.
 */
public enum Currency {
    USD,
    CAD,
    EUR,
    GBP,
    AUD
}
