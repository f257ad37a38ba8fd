package com.paymentengine.api.dto;

import com.paymentengine.refunds.CancellingParty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for a customer's refund request.
 */
@Data
public class RefundRequest {

    @NotBlank(message = "Booking ID is required")
    private String bookingId;

    @NotNull(message = "Cancelling party is required")
    private CancellingParty cancelledBy;

    @NotBlank(message = "Reason is required")
    private String reason;

    private String notes;

    @NotBlank(message = "Requester is required")
    private String requestedBy;
}
