package com.paymentengine.api.controller;

import com.paymentengine.api.dto.OpenDisputeRequest;
import com.paymentengine.disputes.Dispute;
import com.paymentengine.disputes.DisputeService;
import com.paymentengine.disputes.DisputeStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/disputes")
@RequiredArgsConstructor
@Tag(name = "Disputes", description = "Booking dispute API")
public class DisputeController {

    private final DisputeService disputeService;

    @PostMapping
    @Operation(summary = "Open a dispute on a booking")
    public ResponseEntity<Dispute> openDispute(@Valid @RequestBody OpenDisputeRequest request) {
        Dispute dispute = disputeService.open(request.getBookingId(), request.getRaisedBy(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(dispute);
    }

    @GetMapping("/booking/{bookingId}")
    @Operation(summary = "Get the disputes on a booking")
    public ResponseEntity<List<Dispute>> getBookingDisputes(@PathVariable String bookingId) {
        return ResponseEntity.ok(disputeService.listByBooking(bookingId));
    }

    @PutMapping("/{disputeId}/status")
    @Operation(summary = "Move a dispute to a new status")
    public ResponseEntity<Dispute> updateStatus(
            @PathVariable String disputeId,
            @RequestParam DisputeStatus status) {
        return ResponseEntity.ok(disputeService.updateStatus(disputeId, status));
    }
}
