package com.paymentengine.processor;

import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * The only path from the engine to the processor.
 *
 * Bounds every call with a {@link TimeLimiter} and turns every outcome, including
 * timeouts and unexpected exceptions, into a classified {@link ChargeResult}. It never
 * throws, so a worker is never left holding a record in PROCESSING.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChargeGateway {

    private final PaymentProcessorAdapter processorAdapter;
    private final ChargeFailureClassifier failureClassifier;
    private final TimeLimiter processorTimeLimiter;
    private final ExecutorService processorExecutor;

    public ChargeResult charge(ChargeRequest request) {
        log.debug("Charging payment {} via {} with key {}",
            request.getPaymentId(), processorAdapter.getProcessorName(), request.getIdempotencyKey());

        try {
            ChargeResult result = processorTimeLimiter.executeFutureSupplier(
                () -> processorExecutor.submit(() -> processorAdapter.charge(request)));
            return normalise(request, result);

        } catch (ProcessorException e) {
            ChargeFailureCode code = failureClassifier.classify(e.getProcessorCode());
            log.info("Charge for payment {} failed: processorCode={}, classified={}, message={}",
                request.getPaymentId(), e.getProcessorCode(), code, e.getMessage());
            return ChargeResult.failed(code, e.getMessage());

        } catch (TimeoutException e) {
            log.warn("Charge for payment {} timed out after {}",
                request.getPaymentId(), processorTimeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return ChargeResult.failed(ChargeFailureCode.PROCESSOR_UNAVAILABLE, "Payment processor timed out");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChargeResult.failed(ChargeFailureCode.PROCESSOR_UNAVAILABLE, "Charge interrupted");

        } catch (Exception e) {
            log.error("Unexpected error charging payment {}", request.getPaymentId(), e);
            return ChargeResult.failed(ChargeFailureCode.PROCESSOR_UNAVAILABLE,
                "Payment processor error: " + e.getMessage());
        }
    }

    private ChargeResult normalise(ChargeRequest request, ChargeResult result) {
        if (result == null || result.getStatus() == null) {
            log.error("Processor returned no result for payment {}", request.getPaymentId());
            return ChargeResult.failed(ChargeFailureCode.PROCESSOR_UNAVAILABLE, "Empty processor response");
        }
        if (!result.isSucceeded() && result.getFailureCode() == null) {
            result.setFailureCode(ChargeFailureCode.PROCESSOR_UNAVAILABLE);
        }
        return result;
    }
}
