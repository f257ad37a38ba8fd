package com.paymentengine.reconciliation;

import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentRecordService;
import com.paymentengine.payments.PaymentStatus;
import com.paymentengine.processor.ChargeFailureCode;
import com.paymentengine.processor.ChargeGateway;
import com.paymentengine.processor.ChargeRequest;
import com.paymentengine.processor.ChargeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Drives payment records through claim, charge and outcome.
 *
 * Not transactional. The claim commits before the processor is called and the
 * outcome commits in its own transaction afterwards; no transaction is open while
 * the processor call is in flight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationOrchestrator {

    private final PaymentRecordService paymentRecordService;
    private final PaymentStateMachine stateMachine;
    private final PaymentTransitionService transitionService;
    private final ChargeGateway chargeGateway;
    private final Clock clock;

    public PaymentRecord process(String paymentId) {
        return process(paymentId, clock.instant())
            .orElseGet(() -> paymentRecordService.get(paymentId));
    }

    /**
     * Claim and charge one record. Empty when the record was not due or another
     * worker claimed it first.
     */
    public Optional<PaymentRecord> process(String paymentId, Instant now) {
        PaymentRecord current = paymentRecordService.get(paymentId);
        if (!stateMachine.isClaimable(current, now)) {
            log.debug("Payment {} not due ({}), skipping", paymentId, current.getStatus());
            return Optional.empty();
        }

        Optional<PaymentRecord> claimed = paymentRecordService.claimForProcessing(paymentId, now);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }

        PaymentRecord record = claimed.get();
        log.info("Processing payment {} attempt {} (manual retries {})",
            paymentId, record.getRetryCount() + 1, record.getManualRetryCount());

        ChargeResult result = chargeGateway.charge(ChargeRequest.forAttempt(record));
        return Optional.of(transitionService.recordChargeOutcome(paymentId, result, now));
    }

    public ReconciliationResult processDuePayments() {
        return processDuePayments(clock.instant());
    }

    public ReconciliationResult processDuePayments(Instant now) {
        ReconciliationResult result = ReconciliationResult.builder()
            .startedAt(clock.instant())
            .build();

        List<PaymentRecord> due = paymentRecordService.listDue(now);
        log.info("Found {} payments due at {}", due.size(), now);

        for (PaymentRecord record : due) {
            try {
                Optional<PaymentRecord> outcome = process(record.getPaymentId(), now);
                if (outcome.isEmpty()) {
                    result.setSkipped(result.getSkipped() + 1);
                    continue;
                }
                result.setProcessed(result.getProcessed() + 1);
                tally(result, outcome.get());

            } catch (RuntimeException e) {
                result.setErrors(result.getErrors() + 1);
                log.error("Error processing payment {}", record.getPaymentId(), e);
            }
        }

        result.setCompletedAt(clock.instant());
        return result;
    }

    /**
     * Customer-initiated retry: reset the retry budget and charge straight away.
     */
    public PaymentRecord retryNow(String paymentId) {
        Instant now = clock.instant();
        transitionService.resetForManualRetry(paymentId, now);
        return process(paymentId, now)
            .orElseGet(() -> paymentRecordService.get(paymentId));
    }

    public PaymentRecord cancel(String paymentId) {
        return transitionService.cancel(paymentId, clock.instant());
    }

    private void tally(ReconciliationResult result, PaymentRecord record) {
        PaymentStatus status = record.getStatus();
        if (status == PaymentStatus.SUCCEEDED) {
            result.setSucceeded(result.getSucceeded() + 1);
        } else if (status == PaymentStatus.PENDING) {
            result.setRetryScheduled(result.getRetryScheduled() + 1);
        } else if (record.getFailureCode() == ChargeFailureCode.AUTHENTICATION_REQUIRED) {
            result.setActionRequired(result.getActionRequired() + 1);
        } else {
            result.setFailed(result.getFailed() + 1);
        }
    }
}
