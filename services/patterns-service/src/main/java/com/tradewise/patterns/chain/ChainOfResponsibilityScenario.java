package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.factorymethod.ValidationResult;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ChainOfResponsibilityScenario implements PatternScenario {

    private final ValidationHandler orderValidationChain;

    @Override
    public String slug() {
        return "chain-of-responsibility";
    }

    @Override
    public String patternName() {
        return "Chain of Responsibility";
    }

    @Override
    public PatternDemoResponse runDemo() {
        Order validOrder = order("ORD-CHAIN-001", "AAPL", 100, "150");
        Order invalidOrder = order("ORD-CHAIN-002", "", -10, "150");
        Order riskOrder = order("ORD-CHAIN-003", "MSFT", 10_000, "300");

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates chain of responsibility pattern: validation pipeline where each handler processes or passes to next.")
            .result(List.of(
                new ChainOutcome("Valid Order", validOrder.value(), orderValidationChain.handle(validOrder)),
                new ChainOutcome("Invalid Order (Basic Validation)", invalidOrder.value(), orderValidationChain.handle(invalidOrder)),
                new ChainOutcome("Risk Validation", riskOrder.value(), orderValidationChain.handle(riskOrder))))
            .metadata(Map.of(
                "ChainOrder", "Basic -> Risk -> Account",
                "Flexibility", "Easy to add/remove/reorder handlers"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        ValidationResult valid = orderValidationChain.handle(order("ORD-TEST", "TEST", 10, "100"));
        checks.add(new TestCheck("Valid Order Passes", valid.valid(),
            "Valid order passed all validation handlers"));

        ValidationResult invalid = orderValidationChain.handle(order("ORD-TEST", "", -10, "100"));
        checks.add(new TestCheck("Invalid Order Fails", !invalid.valid() && !invalid.errors().isEmpty(),
            "Validation failed with errors: " + String.join(", ", invalid.errors())));

        ValidationResult risk = orderValidationChain.handle(order("ORD-TEST", "TEST", 10_000, "300"));
        boolean riskCaught = !risk.valid() && risk.errors().stream().anyMatch(e -> e.contains("exceeds maximum"));
        checks.add(new TestCheck("Chain Processes in Order", riskCaught,
            "Risk validation handler caught the error"));

        return PatternTestResponse.of(patternName(), checks);
    }

    private static Order order(String orderId, String symbol, long quantity, String price) {
        return Order.builder()
            .orderId(orderId)
            .accountId("ACC-001")
            .symbol(symbol)
            .side(OrderSide.BUY)
            .quantity(quantity)
            .price(new BigDecimal(price))
            .build();
    }

    public record ChainOutcome(String order, BigDecimal orderValue, ValidationResult result) {
    }
}
