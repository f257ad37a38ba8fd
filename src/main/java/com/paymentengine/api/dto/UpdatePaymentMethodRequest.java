package com.paymentengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UpdatePaymentMethodRequest {

    @NotBlank(message = "Instrument ID is required")
    private String instrumentId;
}
