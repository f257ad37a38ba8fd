package com.paymentengine.api.dto;

import com.paymentengine.refunds.CancellingParty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CancelBookingRequest {

    @NotNull(message = "Cancelling party is required")
    private CancellingParty cancelledBy;

    private String reason;
}
