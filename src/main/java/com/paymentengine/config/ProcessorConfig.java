package com.paymentengine.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Timeout and worker pool for calls to the card processor.
 */
@Configuration
public class ProcessorConfig {

    @Bean
    public TimeLimiter processorTimeLimiter(
            @Value("${payment-engine.processor.timeout-ms:10000}") long timeoutMs) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(timeoutMs))
            // interrupt the worker so a hung call does not hold a pool thread
            .cancelRunningFuture(true)
            .build();
        return TimeLimiter.of("processor", config);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService processorExecutor(
            @Value("${payment-engine.processor.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize);
    }
}
