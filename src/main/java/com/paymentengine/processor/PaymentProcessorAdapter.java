package com.paymentengine.processor;

/**
 * Boundary to the card-charging provider.
 *
 * Implementations translate a {@link ChargeRequest} into the provider's API call and
 * must pass the idempotency key through unchanged so a re-sent request never charges
 * twice. Provider-level failures are either returned as a failed {@link ChargeResult}
 * or thrown as {@link ProcessorException}; {@link ChargeGateway} normalises both.
 */
public interface PaymentProcessorAdapter {

    /**
     * Charge the instrument once.
     *
     * @param request what to charge, with its idempotency key
     * @return the provider's outcome
     * @throws ProcessorException for declines and provider errors
     */
    ChargeResult charge(ChargeRequest request);

    /**
     * Get the processor name.
     */
    String getProcessorName();
}
