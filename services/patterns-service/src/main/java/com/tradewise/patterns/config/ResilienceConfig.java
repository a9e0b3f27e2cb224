package com.tradewise.patterns.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j Configuration
 *
 * Retry Strategy:
 * - Linear backoff (attempt × base wait) for both retrying call sites
 * - Attempt budget and base wait taken from {@link PatternsProperties}
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String COMMAND_RETRY = "commandHandler";
    public static final String PAYMENT_RETRY = "paymentService";

    @Bean
    public RetryRegistry retryRegistry(PatternsProperties properties) {
        log.info("Initializing Retry Registry");

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.addConfiguration(COMMAND_RETRY, linearRetry(properties.getCommand()));
        registry.addConfiguration(PAYMENT_RETRY, linearRetry(properties.getDecorator()));

        registry.getEventPublisher()
            .onEntryAdded(event -> log.info("Retry instance registered: {}", event.getAddedEntry().getName()));

        return registry;
    }

    static RetryConfig linearRetry(PatternsProperties.RetryPolicy policy) {
        long baseMillis = policy.getBackoff().toMillis();
        return RetryConfig.custom()
            .maxAttempts(policy.getMaxAttempts())
            .intervalFunction(linearInterval(baseMillis))
            .build();
    }

    /**
     * Attempt n (1-based) waits n × base before the next try.
     */
    static IntervalFunction linearInterval(long baseMillis) {
        return attempt -> attempt * baseMillis;
    }
}
