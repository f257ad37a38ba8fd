package com.paymentengine.reconciliation;

import com.paymentengine.agreements.RecurringAgreementService;
import com.paymentengine.payments.PaymentRecordService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Periodic reconciliation run.
 * <p>
 * Each run opens the billing cycles that have come due, hands stale claims back
 * to the queue, then charges everything due. fixedDelay keeps runs from overlapping
 * on one node; across nodes the claim compare-and-swap does.
 */
@Component
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationOrchestrator orchestrator;
    private final RecurringAgreementService agreementService;
    private final PaymentRecordService paymentRecordService;
    private final Clock clock;
    private final boolean enabled;
    private final ZoneId billingZone;
    private final Duration staleClaimAfter;

    public ReconciliationScheduler(ReconciliationOrchestrator orchestrator,
                                   RecurringAgreementService agreementService,
                                   PaymentRecordService paymentRecordService,
                                   Clock clock,
                                   @Value("${payment-engine.scheduler.enabled:true}") boolean enabled,
                                   @Value("${payment-engine.scheduler.billing-zone:UTC}") String billingZone,
                                   @Value("${payment-engine.scheduler.stale-claim-minutes:15}") long staleClaimMinutes) {
        this.orchestrator = orchestrator;
        this.agreementService = agreementService;
        this.paymentRecordService = paymentRecordService;
        this.clock = clock;
        this.enabled = enabled;
        this.billingZone = ZoneId.of(billingZone);
        this.staleClaimAfter = Duration.ofMinutes(staleClaimMinutes);
    }

    @Scheduled(fixedDelayString = "${payment-engine.scheduler.interval-ms:300000}",
               initialDelayString = "${payment-engine.scheduler.initial-delay-ms:60000}")
    public void runScheduledReconciliation() {
        if (!enabled) {
            log.debug("Scheduler is disabled, skipping reconciliation run");
            return;
        }

        try {
            ReconciliationResult result = runOnce();
            logResult(result);

            if (result.getErrors() > 0 && result.getErrors() * 10 > result.getProcessed()) {
                log.warn("High error rate in reconciliation: {} errors out of {} processed",
                    result.getErrors(), result.getProcessed());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled reconciliation failed with unexpected error", e);
        }
    }

    public ReconciliationResult runOnce() {
        Instant now = clock.instant();
        agreementService.openDueBillingCycles(LocalDate.ofInstant(now, billingZone));
        paymentRecordService.releaseStaleClaims(now.minus(staleClaimAfter), now);
        return orchestrator.processDuePayments(now);
    }

    private void logResult(ReconciliationResult result) {
        if (result.getProcessed() == 0 && result.getSkipped() == 0) {
            log.info("No payments due");
            return;
        }
        log.info("Reconciliation completed in {}ms: {} processed, {} succeeded, {} retrying, "
                + "{} failed, {} awaiting action, {} skipped, {} errors",
            result.getDurationMs(),
            result.getProcessed(),
            result.getSucceeded(),
            result.getRetryScheduled(),
            result.getFailed(),
            result.getActionRequired(),
            result.getSkipped(),
            result.getErrors());
    }
}
