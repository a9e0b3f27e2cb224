package com.tradewise.patterns.mediator;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
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
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MediatorScenario implements PatternScenario {

    private final Mediator mediator;

    @Override
    public String slug() {
        return "mediator";
    }

    @Override
    public String patternName() {
        return "Mediator";
    }

    @Override
    public PatternDemoResponse runDemo() {
        CreateOrderRequest createRequest = new CreateOrderRequest("ACC-001", "AAPL", OrderSide.BUY, 100, new BigDecimal("150"));
        Order order = mediator.send(createRequest);

        GetOrderRequest getRequest = new GetOrderRequest(order.getOrderId());
        Optional<Order> retrieved = mediator.send(getRequest);

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates mediator pattern: routes requests to handlers, reducing many-to-many dependencies between components.")
            .result(List.of(
                new MediatedCall("Create Order via Mediator", createRequest, order),
                new MediatedCall("Get Order via Mediator", getRequest, retrieved.orElse(null))))
            .metadata(Map.of(
                "Decoupling", "Components don't know about each other, only the mediator",
                "RequestRouting", "Mediator routes requests to appropriate handlers"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        Order order = mediator.send(new CreateOrderRequest("ACC-TEST", "TEST", OrderSide.BUY, 10, new BigDecimal("100")));
        checks.add(new TestCheck("Mediator Routes Create Request", order != null,
            "Created order " + order.getOrderId() + " via mediator"));

        Optional<Order> retrieved = mediator.send(new GetOrderRequest(order.getOrderId()));
        checks.add(new TestCheck("Mediator Routes Get Request",
            retrieved.map(Order::getOrderId).filter(order.getOrderId()::equals).isPresent(),
            "Retrieved order " + retrieved.map(Order::getOrderId).orElse(null) + " via mediator"));

        Optional<Order> missing = mediator.send(new GetOrderRequest("NONEXISTENT"));
        checks.add(new TestCheck("Mediator Handles Missing Order", missing.isEmpty(),
            "Mediator correctly returns empty for missing order"));

        return PatternTestResponse.of(patternName(), checks);
    }

    public record MediatedCall(String action, Request<?> request, Order order) {
    }
}
