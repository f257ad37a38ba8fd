package com.paymentengine.agreements;

import java.time.LocalDate;

public enum BillingFrequency {
    DAILY,
    WEEKLY,
    BIWEEKLY,
    MONTHLY;

    public LocalDate next(LocalDate from) {
        switch (this) {
            case DAILY:
                return from.plusDays(1);
            case WEEKLY:
                return from.plusWeeks(1);
            case BIWEEKLY:
                return from.plusWeeks(2);
            case MONTHLY:
                return from.plusMonths(1);
            default:
                throw new IllegalStateException("Unknown frequency: " + this);
        }
    }
}
