package com.paymentengine.api.controller;

import com.paymentengine.api.dto.CancelBookingRequest;
import com.paymentengine.api.dto.CreateBookingRequest;
import com.paymentengine.bookings.Booking;
import com.paymentengine.bookings.BookingCancellation;
import com.paymentengine.bookings.BookingService;
import com.paymentengine.common.Money;
import com.paymentengine.refunds.CancellingParty;
import com.paymentengine.refunds.RefundEligibility;
import com.paymentengine.refunds.RefundService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for booking completion and cancellation.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
@Tag(name = "Bookings", description = "Booking lifecycle API")
public class BookingController {

    private final BookingService bookingService;
    private final RefundService refundService;

    @PostMapping
    @Operation(summary = "Record a paid booking and hold its payout in escrow")
    public ResponseEntity<Booking> createBooking(@Valid @RequestBody CreateBookingRequest request) {
        Booking booking = bookingService.createBooking(
            request.getCustomerId(),
            request.getProviderId(),
            request.getBookingType(),
            request.getScheduledDate(),
            request.getScheduledTime(),
            Money.of(request.getPrice(), request.getCurrency()),
            Money.of(request.getProviderPayout(), request.getCurrency())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(booking);
    }

    @GetMapping("/{bookingId}")
    @Operation(summary = "Get a booking")
    public ResponseEntity<Booking> getBooking(@PathVariable String bookingId) {
        return ResponseEntity.ok(bookingService.get(bookingId));
    }

    @GetMapping("/{bookingId}/refund-eligibility")
    @Operation(summary = "Refund the booking would get if cancelled now")
    public ResponseEntity<RefundEligibility> getRefundEligibility(
            @PathVariable String bookingId,
            @RequestParam(defaultValue = "CUSTOMER") CancellingParty cancelledBy) {
        return ResponseEntity.ok(refundService.checkEligibility(bookingId, cancelledBy));
    }

    @PostMapping("/{bookingId}/complete")
    @Operation(summary = "Complete a booking and schedule the provider payout")
    public ResponseEntity<Booking> completeBooking(@PathVariable String bookingId) {
        return ResponseEntity.ok(bookingService.completeBooking(bookingId));
    }

    @PostMapping("/{bookingId}/cancel")
    @Operation(summary = "Cancel a booking and refund the customer per policy")
    public ResponseEntity<BookingCancellation> cancelBooking(
            @PathVariable String bookingId,
            @Valid @RequestBody CancelBookingRequest request) {
        return ResponseEntity.ok(bookingService.cancelBooking(bookingId, request.getCancelledBy(), request.getReason()));
    }
}
