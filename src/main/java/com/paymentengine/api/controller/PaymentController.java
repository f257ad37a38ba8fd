package com.paymentengine.api.controller;

import com.paymentengine.api.dto.CreatePaymentRequest;
import com.paymentengine.common.Money;
import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentRecordService;
import com.paymentengine.payments.PaymentStats;
import com.paymentengine.reconciliation.ReconciliationOrchestrator;
import com.paymentengine.reconciliation.ReconciliationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for recurring payment records and their reconciliation.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Recurring payment and retry API")
public class PaymentController {

    private final PaymentRecordService paymentRecordService;
    private final ReconciliationOrchestrator orchestrator;

    @PostMapping
    @Operation(summary = "Open a payment record")
    public ResponseEntity<PaymentRecord> createPayment(@Valid @RequestBody CreatePaymentRequest request) {
        PaymentRecord record = paymentRecordService.create(
            request.getAgreementId(),
            request.getPayerId(),
            request.getInstrumentId(),
            Money.of(request.getAmount(), request.getCurrency())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @GetMapping("/{paymentId}")
    @Operation(summary = "Get a payment record")
    public ResponseEntity<PaymentRecord> getPayment(@PathVariable String paymentId) {
        return ResponseEntity.ok(paymentRecordService.get(paymentId));
    }

    @GetMapping("/agreement/{agreementId}")
    @Operation(summary = "Payment history of an agreement, newest first")
    public ResponseEntity<List<PaymentRecord>> getAgreementPayments(@PathVariable String agreementId) {
        return ResponseEntity.ok(paymentRecordService.listByAgreement(agreementId));
    }

    @GetMapping("/payer/{payerId}/stats")
    @Operation(summary = "Payment totals and success rate for a payer")
    public ResponseEntity<PaymentStats> getPayerStats(@PathVariable String payerId) {
        return ResponseEntity.ok(paymentRecordService.getStats(payerId));
    }

    @PostMapping("/{paymentId}/process")
    @Operation(summary = "Charge a payment if it is due")
    public ResponseEntity<PaymentRecord> processPayment(@PathVariable String paymentId) {
        return ResponseEntity.ok(orchestrator.process(paymentId));
    }

    @PostMapping("/{paymentId}/retry")
    @Operation(summary = "Retry a pending or failed payment now")
    public ResponseEntity<PaymentRecord> retryPayment(@PathVariable String paymentId) {
        return ResponseEntity.ok(orchestrator.retryNow(paymentId));
    }

    @PostMapping("/{paymentId}/cancel")
    @Operation(summary = "Cancel a pending or failed payment")
    public ResponseEntity<PaymentRecord> cancelPayment(@PathVariable String paymentId) {
        return ResponseEntity.ok(orchestrator.cancel(paymentId));
    }

    @PostMapping("/reconcile")
    @Operation(summary = "Charge every due payment")
    public ResponseEntity<ReconciliationResult> reconcile() {
        return ResponseEntity.ok(orchestrator.processDuePayments());
    }
}
