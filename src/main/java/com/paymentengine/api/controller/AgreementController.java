package com.paymentengine.api.controller;

import com.paymentengine.agreements.RecurringAgreement;
import com.paymentengine.agreements.RecurringAgreementService;
import com.paymentengine.api.dto.CreateAgreementRequest;
import com.paymentengine.api.dto.PauseAgreementRequest;
import com.paymentengine.api.dto.UpdatePaymentMethodRequest;
import com.paymentengine.common.Money;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for recurring agreements.
 */
@RestController
@RequestMapping("/api/v1/agreements")
@RequiredArgsConstructor
@Tag(name = "Agreements", description = "Recurring booking agreement API")
public class AgreementController {

    private final RecurringAgreementService agreementService;

    @PostMapping
    @Operation(summary = "Create a recurring agreement")
    public ResponseEntity<RecurringAgreement> createAgreement(@Valid @RequestBody CreateAgreementRequest request) {
        RecurringAgreement agreement = agreementService.create(
            request.getCustomerId(),
            request.getProviderId(),
            request.getInstrumentId(),
            Money.of(request.getAmount(), request.getCurrency()),
            request.getFrequency(),
            request.getFirstBillingDate()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(agreement);
    }

    @GetMapping("/{agreementId}")
    @Operation(summary = "Get an agreement")
    public ResponseEntity<RecurringAgreement> getAgreement(@PathVariable String agreementId) {
        return ResponseEntity.ok(agreementService.get(agreementId));
    }

    @GetMapping("/customer/{customerId}")
    @Operation(summary = "Get all agreements of a customer")
    public ResponseEntity<List<RecurringAgreement>> getCustomerAgreements(@PathVariable String customerId) {
        return ResponseEntity.ok(agreementService.listByCustomer(customerId));
    }

    @PostMapping("/{agreementId}/pause")
    @Operation(summary = "Pause billing")
    public ResponseEntity<RecurringAgreement> pauseAgreement(
            @PathVariable String agreementId,
            @Valid @RequestBody PauseAgreementRequest request) {
        return ResponseEntity.ok(agreementService.pause(agreementId, request.getReason()));
    }

    @PostMapping("/{agreementId}/resume")
    @Operation(summary = "Resume billing")
    public ResponseEntity<RecurringAgreement> resumeAgreement(@PathVariable String agreementId) {
        return ResponseEntity.ok(agreementService.resume(agreementId));
    }

    @PutMapping("/{agreementId}/payment-method")
    @Operation(summary = "Switch the agreement and its pending payments to a new instrument")
    public ResponseEntity<RecurringAgreement> updatePaymentMethod(
            @PathVariable String agreementId,
            @Valid @RequestBody UpdatePaymentMethodRequest request) {
        return ResponseEntity.ok(agreementService.updatePaymentMethod(agreementId, request.getInstrumentId()));
    }
}
