package com.paymentengine.ledger;

/**
 * Kinds of money movement recorded in the ledger.
 */
public enum TransactionType {
    /**
     * Successful charge of a recurring payment. Money in from the payer.
     */
    PAYMENT,

    /**
     * Escrowed funds released to a provider's wallet.
     */
    PAYOUT,

    /**
     * Cancellation refund credited to a customer's wallet.
     */
    REFUND
}
