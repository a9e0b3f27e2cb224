package com.tradewise.patterns.decorator;

import com.tradewise.common.gateway.PaymentRequest;
import com.tradewise.common.gateway.PaymentResult;
import com.tradewise.common.metrics.MetricsSink;
import com.tradewise.common.metrics.MetricsSnapshot;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class DecoratorScenario implements PatternScenario {

    private final PaymentService paymentService;
    private final MetricsSink metricsSink;

    @Override
    public String slug() {
        return "decorator";
    }

    @Override
    public String patternName() {
        return "Decorator";
    }

    @Override
    public PatternDemoResponse runDemo() {
        PaymentRequest request = new PaymentRequest("TXN-DEC-001", new BigDecimal("250.75"), "USD", "ACC-001", null);
        PaymentResult result = paymentService.processPayment(request);

        List<Object> results = List.of(
            new DecoratedPayment(request, result, List.of("Logging", "Metrics", "Retry")),
            Map.of("metrics", metricsSink.snapshot()));

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates decorator pattern: adds cross-cutting concerns (logging, metrics, retries) dynamically without modifying core service.")
            .result(results)
            .metadata(Map.of(
                "DecoratorStack", "Retry -> Metrics -> Logging -> Core",
                "SeparationOfConcerns", true))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        PaymentRequest request = new PaymentRequest("TXN-TEST-001", new BigDecimal("100"), "USD", "ACC-TEST", null);
        PaymentResult result = paymentService.processPayment(request);
        checks.add(new TestCheck("Payment Processing", result != null,
            "Payment processed: Success=" + result.success()));

        MetricsSnapshot snapshot = metricsSink.snapshot();
        boolean recorded = snapshot.counters().keySet().stream()
            .anyMatch(key -> key.startsWith(MetricsPaymentServiceDecorator.COUNT_METRIC));
        checks.add(new TestCheck("Metrics Recording", recorded, "Metrics were recorded by decorator"));

        checks.add(new TestCheck("Decorator Chain",
            request.transactionId().equals(result.transactionId()),
            "Decorator chain preserved request/response flow"));

        return PatternTestResponse.of(patternName(), checks);
    }

    public record DecoratedPayment(PaymentRequest paymentRequest, PaymentResult paymentResult, List<String> decorators) {
    }
}
