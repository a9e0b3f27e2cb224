package com.tradewise.patterns.decorator;

import com.tradewise.common.gateway.PaymentRequest;
import com.tradewise.common.gateway.PaymentResult;
import com.tradewise.common.metrics.MetricsSink;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Map;

/**
 * Records call duration and outcome counts. Exceptions are counted as failures and rethrown.
 */
@RequiredArgsConstructor
public class MetricsPaymentServiceDecorator implements PaymentService {

    static final String DURATION_METRIC = "payment.process.duration";
    static final String COUNT_METRIC = "payment.process.count";

    private final PaymentService inner;
    private final MetricsSink metrics;

    @Override
    public PaymentResult processPayment(PaymentRequest request) {
        long start = System.nanoTime();
        try {
            PaymentResult result = inner.processPayment(request);
            String success = String.valueOf(result.success());
            metrics.recordDuration(DURATION_METRIC, elapsedSince(start),
                Map.of("success", success, "currency", request.currency()));
            metrics.incrementCounter(COUNT_METRIC, Map.of("success", success));
            return result;
        } catch (RuntimeException e) {
            metrics.recordDuration(DURATION_METRIC, elapsedSince(start),
                Map.of("success", "false", "error", "exception"));
            metrics.incrementCounter(COUNT_METRIC, Map.of("success", "false"));
            throw e;
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
