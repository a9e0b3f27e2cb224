package com.tradewise.patterns.decorator;

import com.tradewise.common.gateway.FakeStripeGateway;
import com.tradewise.common.gateway.PaymentResult;
import com.tradewise.common.metrics.MetricsSink;
import com.tradewise.patterns.config.PatternsProperties;
import com.tradewise.patterns.config.ResilienceConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Assembles the decorated payment service: Retry -> Metrics -> Logging -> Core.
 */
@Configuration
public class DecoratorConfiguration {

    @Bean
    public PaymentService decoratedPaymentService(PatternsProperties properties,
                                                  MetricsSink metricsSink,
                                                  RetryRegistry retryRegistry) {
        PatternsProperties.Simulation stripe = properties.getGateways().getStripe();
        PaymentService core = new CorePaymentService(
            new FakeStripeGateway(new Random(stripe.getSeed()), stripe.getLatency()));

        RetryConfig retryConfig = RetryConfig.<PaymentResult>from(
                retryRegistry.getConfiguration(ResilienceConfig.PAYMENT_RETRY)
                    .orElseGet(retryRegistry::getDefaultConfig))
            .retryOnResult(result -> !result.success())
            .build();
        Retry retry = retryRegistry.retry(ResilienceConfig.PAYMENT_RETRY, retryConfig);

        return new RetryPaymentServiceDecorator(
            new MetricsPaymentServiceDecorator(
                new LoggingPaymentServiceDecorator(core),
                metricsSink),
            retry);
    }
}
