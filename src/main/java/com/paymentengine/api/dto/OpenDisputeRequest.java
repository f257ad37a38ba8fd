package com.paymentengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OpenDisputeRequest {

    @NotBlank(message = "Booking ID is required")
    private String bookingId;

    @NotBlank(message = "Raised by is required")
    private String raisedBy;

    @NotBlank(message = "Reason is required")
    private String reason;
}
