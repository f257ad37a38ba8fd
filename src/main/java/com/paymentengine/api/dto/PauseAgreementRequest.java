package com.paymentengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PauseAgreementRequest {

    @NotBlank(message = "Reason is required")
    private String reason;
}
