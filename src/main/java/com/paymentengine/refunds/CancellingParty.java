package com.paymentengine.refunds;

public enum CancellingParty {
    CUSTOMER,
    PROVIDER
}
