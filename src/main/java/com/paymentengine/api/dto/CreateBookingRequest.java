package com.paymentengine.api.dto;

import com.paymentengine.bookings.BookingType;
import com.paymentengine.common.Currency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * DTO for recording a paid booking.
 */
@Data
public class CreateBookingRequest {

    @NotBlank(message = "Customer ID is required")
    private String customerId;

    @NotBlank(message = "Provider ID is required")
    private String providerId;

    @NotNull(message = "Booking type is required")
    private BookingType bookingType;

    @NotNull(message = "Scheduled date is required")
    private LocalDate scheduledDate;

    private LocalTime scheduledTime;

    @NotNull(message = "Price is required")
    @Positive(message = "Price must be positive")
    private BigDecimal price;

    @NotNull(message = "Provider payout is required")
    @Positive(message = "Provider payout must be positive")
    private BigDecimal providerPayout;

    @NotNull(message = "Currency is required")
    private Currency currency;
}
