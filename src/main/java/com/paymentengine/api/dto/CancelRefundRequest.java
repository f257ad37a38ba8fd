package com.paymentengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for withdrawing a pending refund request.
 */
@Data
public class CancelRefundRequest {

    @NotBlank(message = "User ID is required")
    private String userId;
}
