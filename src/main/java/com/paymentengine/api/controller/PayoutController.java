package com.paymentengine.api.controller;

import com.paymentengine.escrow.EarlyPayoutResult;
import com.paymentengine.escrow.PayoutSchedule;
import com.paymentengine.escrow.PayoutService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for provider payouts.
 */
@RestController
@RequestMapping("/api/v1/payouts")
@RequiredArgsConstructor
@Tag(name = "Payouts", description = "Escrow payout API")
public class PayoutController {

    private final PayoutService payoutService;

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get a payout schedule")
    public ResponseEntity<PayoutSchedule> getSchedule(@PathVariable String scheduleId) {
        return ResponseEntity.ok(payoutService.get(scheduleId));
    }

    @GetMapping("/provider/{providerId}")
    @Operation(summary = "Get a provider's payout schedules")
    public ResponseEntity<List<PayoutSchedule>> getProviderSchedules(@PathVariable String providerId) {
        return ResponseEntity.ok(payoutService.listByProvider(providerId));
    }

    @PostMapping("/{scheduleId}/early-request")
    @Operation(summary = "Request early payout")
    public ResponseEntity<PayoutSchedule> requestEarlyPayout(@PathVariable String scheduleId) {
        return ResponseEntity.ok(payoutService.requestEarlyPayout(scheduleId));
    }

    @PostMapping("/{scheduleId}/release-early")
    @Operation(summary = "Release a requested early payout")
    public ResponseEntity<EarlyPayoutResult> releaseEarly(@PathVariable String scheduleId) {
        return ResponseEntity.ok(payoutService.releaseEarly(scheduleId));
    }
}
