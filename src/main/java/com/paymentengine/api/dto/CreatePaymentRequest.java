package com.paymentengine.api.dto;

import com.paymentengine.common.Currency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for opening a payment record outside the billing cycle.
 */
@Data
public class CreatePaymentRequest {

    @NotBlank(message = "Agreement ID is required")
    private String agreementId;

    @NotBlank(message = "Payer ID is required")
    private String payerId;

    @NotBlank(message = "Instrument ID is required")
    private String instrumentId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    @NotNull(message = "Currency is required")
    private Currency currency;
}
