package com.paymentengine.api.dto;

import com.paymentengine.agreements.BillingFrequency;
import com.paymentengine.common.Currency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for setting up a recurring booking agreement.
 */
@Data
public class CreateAgreementRequest {

    @NotBlank(message = "Customer ID is required")
    private String customerId;

    @NotBlank(message = "Provider ID is required")
    private String providerId;

    @NotBlank(message = "Instrument ID is required")
    private String instrumentId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    @NotNull(message = "Currency is required")
    private Currency currency;

    @NotNull(message = "Frequency is required")
    private BillingFrequency frequency;

    @NotNull(message = "First billing date is required")
    private LocalDate firstBillingDate;
}
