package com.tradewise.patterns.builder;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class BuilderScenario implements PatternScenario {

    private final ObjectProvider<OrderBuilder> builders;

    @Override
    public String slug() {
        return "builder";
    }

    @Override
    public String patternName() {
        return "Builder";
    }

    @Override
    public PatternDemoResponse runDemo() {
        OrderBuilder builder = builders.getObject();

        Order simpleOrder = builder.reset()
            .withAccount("ACC-001")
            .withSymbol("AAPL")
            .withSide(OrderSide.BUY)
            .withQuantity(100)
            .withPrice(new BigDecimal("150"))
            .build();

        Order complexOrder = builder.reset()
            .withAccount("ACC-002")
            .withSymbol("MSFT")
            .withSide(OrderSide.SELL)
            .withQuantity(500)
            .withPrice(new BigDecimal("300"))
            .withLimitPrice(new BigDecimal("305"))
            .build();

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates builder pattern: fluent interface for constructing complex Order objects step-by-step.")
            .result(List.of(new BuiltOrder("Simple Order", simpleOrder), new BuiltOrder("Complex Order", complexOrder)))
            .metadata(Map.of(
                "FluentInterface", true,
                "Validation", "Builder validates required fields before building"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();
        OrderBuilder builder = builders.getObject();

        Order order = builder.reset()
            .withAccount("ACC-TEST")
            .withSymbol("TEST")
            .withSide(OrderSide.BUY)
            .withQuantity(10)
            .withPrice(new BigDecimal("100"))
            .build();
        checks.add(new TestCheck("Builder Creates Valid Order", order.getOrderId().startsWith("ORD-"),
            "Created order " + order.getOrderId()));

        boolean valuesMatch = "ACC-TEST".equals(order.getAccountId())
            && "TEST".equals(order.getSymbol())
            && order.getQuantity() == 10;
        checks.add(new TestCheck("Order Values Correct", valuesMatch,
            String.format("Order values match: Account=%s, Symbol=%s, Quantity=%d",
                order.getAccountId(), order.getSymbol(), order.getQuantity())));

        checks.add(missingFieldCheck(builder));

        return PatternTestResponse.of(patternName(), checks);
    }

    private TestCheck missingFieldCheck(OrderBuilder builder) {
        try {
            builder.reset().withAccount("ACC-TEST").build();
            return new TestCheck("Builder Validation", false, "Builder should throw on missing required fields");
        } catch (IllegalStateException e) {
            log.debug("Builder rejected incomplete order: {}", e.getMessage());
            return new TestCheck("Builder Validation", true,
                "Builder correctly validates required fields: " + e.getMessage());
        }
    }

    public record BuiltOrder(String type, Order order) {
    }
}
