package com.paymentengine.processor;

import com.paymentengine.common.Currency;
import com.paymentengine.common.IdempotencyKey;
import com.paymentengine.common.Money;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ChargeGateway.
 *
 * The gateway must turn every processor outcome into a classified result:
 * - provider errors are classified by code
 * - timeouts and unexpected exceptions become PROCESSOR_UNAVAILABLE
 */
@ExtendWith(MockitoExtension.class)
class ChargeGatewayTest {

    @Mock
    private PaymentProcessorAdapter processorAdapter;

    private ExecutorService executor;
    private ChargeGateway gateway;

    private final ChargeRequest request = ChargeRequest.builder()
        .paymentId("payment-1")
        .payerId("payer-1")
        .instrumentId("pm_card_visa")
        .amount(Money.of("49.99", Currency.USD))
        .idempotencyKey(IdempotencyKey.forChargeAttempt("payment-1", 0, 0))
        .build();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        TimeLimiter timeLimiter = TimeLimiter.of("processor", TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(200))
            .cancelRunningFuture(true)
            .build());
        gateway = new ChargeGateway(processorAdapter, new ChargeFailureClassifier(), timeLimiter, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testCharge_Success() {
        when(processorAdapter.charge(request)).thenReturn(ChargeResult.succeeded("ch_123"));

        ChargeResult result = gateway.charge(request);

        assertTrue(result.isSucceeded());
        assertEquals("ch_123", result.getExternalReference());
        verify(processorAdapter).charge(request);
    }

    @Test
    void testCharge_ProviderErrorIsClassified() {
        when(processorAdapter.charge(any())).thenThrow(new ProcessorException("insufficient_funds", "Not enough money"));

        ChargeResult result = gateway.charge(request);

        assertEquals(ChargeStatus.FAILED, result.getStatus());
        assertEquals(ChargeFailureCode.INSUFFICIENT_FUNDS, result.getFailureCode());
        assertEquals("Not enough money", result.getFailureReason());
    }

    @Test
    void testCharge_TimeoutBecomesProcessorUnavailable() {
        when(processorAdapter.charge(any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return ChargeResult.succeeded("ch_late");
        });

        long started = System.nanoTime();
        ChargeResult result = gateway.charge(request);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, result.getFailureCode());
        assertEquals("Payment processor timed out", result.getFailureReason());
        assertTrue(elapsedMs < 1_500, "gateway waited " + elapsedMs + "ms");
    }

    @Test
    void testCharge_UnexpectedExceptionBecomesProcessorUnavailable() {
        when(processorAdapter.charge(any())).thenThrow(new IllegalStateException("boom"));

        ChargeResult result = gateway.charge(request);

        assertEquals(ChargeStatus.FAILED, result.getStatus());
        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, result.getFailureCode());
    }

    @Test
    void testCharge_FailureWithoutCodeIsNormalised() {
        when(processorAdapter.charge(any())).thenReturn(ChargeResult.failed(null, "unclear"));

        ChargeResult result = gateway.charge(request);

        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, result.getFailureCode());
    }

    @Test
    void testCharge_NullResult() {
        when(processorAdapter.charge(any())).thenReturn(null);

        ChargeResult result = gateway.charge(request);

        assertEquals(ChargeStatus.FAILED, result.getStatus());
        assertEquals(ChargeFailureCode.PROCESSOR_UNAVAILABLE, result.getFailureCode());
    }
}
