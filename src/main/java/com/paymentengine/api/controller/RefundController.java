package com.paymentengine.api.controller;

import com.paymentengine.api.dto.CancelRefundRequest;
import com.paymentengine.api.dto.RefundRequest;
import com.paymentengine.refunds.Refund;
import com.paymentengine.refunds.RefundService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for refund requests.
 */
@RestController
@RequestMapping("/api/v1/refunds")
@RequiredArgsConstructor
@Tag(name = "Refunds", description = "Cancellation refund API")
public class RefundController {

    private final RefundService refundService;

    @PostMapping
    @Operation(summary = "Request a refund for a booking")
    public ResponseEntity<Refund> requestRefund(@Valid @RequestBody RefundRequest request) {
        Refund refund = refundService.requestRefund(
            request.getBookingId(),
            request.getCancelledBy(),
            request.getReason(),
            request.getNotes(),
            request.getRequestedBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(refund);
    }

    @GetMapping("/{refundId}")
    @Operation(summary = "Get a refund")
    public ResponseEntity<Refund> getRefund(@PathVariable String refundId) {
        return ResponseEntity.ok(refundService.get(refundId));
    }

    @GetMapping("/customer/{customerId}")
    @Operation(summary = "Get all refunds of a customer")
    public ResponseEntity<List<Refund>> getCustomerRefunds(@PathVariable String customerId) {
        return ResponseEntity.ok(refundService.listByCustomer(customerId));
    }

    @PostMapping("/{refundId}/complete")
    @Operation(summary = "Credit a pending refund to the customer's wallet")
    public ResponseEntity<Refund> completeRefund(@PathVariable String refundId) {
        return ResponseEntity.ok(refundService.completeRefund(refundId));
    }

    @PostMapping("/{refundId}/cancel")
    @Operation(summary = "Withdraw a pending refund request")
    public ResponseEntity<Refund> cancelRefund(@PathVariable String refundId,
                                               @Valid @RequestBody CancelRefundRequest request) {
        return ResponseEntity.ok(refundService.cancelRefund(refundId, request.getUserId()));
    }
}
