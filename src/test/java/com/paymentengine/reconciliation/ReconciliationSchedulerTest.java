package com.paymentengine.reconciliation;

import com.paymentengine.agreements.RecurringAgreementService;
import com.paymentengine.payments.PaymentRecordService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T23:30:00Z");

    @Mock
    private ReconciliationOrchestrator orchestrator;

    @Mock
    private RecurringAgreementService agreementService;

    @Mock
    private PaymentRecordService paymentRecordService;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void testRunOpensCyclesReleasesStaleClaimsThenCharges() {
        ReconciliationScheduler scheduler = scheduler(true, "Asia/Tokyo");
        when(orchestrator.processDuePayments(NOW)).thenReturn(ReconciliationResult.builder().processed(2).build());

        scheduler.runScheduledReconciliation();

        verify(agreementService).openDueBillingCycles(LocalDate.of(2026, 3, 11));
        verify(paymentRecordService).releaseStaleClaims(NOW.minus(Duration.ofMinutes(15)), NOW);
        verify(orchestrator).processDuePayments(NOW);
    }

    @Test
    void testDisabledSchedulerDoesNothing() {
        scheduler(false, "UTC").runScheduledReconciliation();

        verifyNoInteractions(orchestrator, agreementService, paymentRecordService);
    }

    @Test
    void testFailedRunIsContained() {
        ReconciliationScheduler scheduler = scheduler(true, "UTC");
        when(agreementService.openDueBillingCycles(any())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(scheduler::runScheduledReconciliation);
        verifyNoInteractions(orchestrator);
    }

    private ReconciliationScheduler scheduler(boolean enabled, String zone) {
        return new ReconciliationScheduler(orchestrator, agreementService, paymentRecordService,
            clock, enabled, zone, 15);
    }
}
