package com.tradewise.patterns.factorymethod;

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

@Component
@RequiredArgsConstructor
public class FactoryMethodScenario implements PatternScenario {

    private final OrderValidatorFactory validatorFactory;

    @Override
    public String slug() {
        return "factory-method";
    }

    @Override
    public String patternName() {
        return "Factory Method";
    }

    @Override
    public PatternDemoResponse runDemo() {
        Order standardOrder = order("ORD-001", "AAPL", 100, "150");
        Order largeOrder = order("ORD-002", "MSFT", 1000, "300");

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates factory method pattern: different validators created based on order characteristics.")
            .result(List.of(validate("Standard", standardOrder), validate("Large", largeOrder)))
            .metadata(Map.of(
                "FactoryType", "OrderValidatorFactory",
                "Extensibility", "Easy to add new validator types without modifying existing code"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        Order standardOrder = order("TEST-001", "AAPL", 10, "100");
        OrderValidator standardValidator = validatorFactory.createValidator(standardOrder);
        checks.add(new TestCheck("Standard Order Validator",
            StandardOrderValidator.TYPE.equals(standardValidator.getValidatorType()),
            "Created " + standardValidator.getValidatorType() + " validator for standard order"));

        Order largeOrder = order("TEST-002", "MSFT", 1000, "200");
        OrderValidator largeValidator = validatorFactory.createValidator(largeOrder);
        checks.add(new TestCheck("Large Order Validator",
            LargeOrderValidator.TYPE.equals(largeValidator.getValidatorType()),
            String.format("Created %s validator for large order (value: %s)",
                largeValidator.getValidatorType(), largeOrder.value())));

        ValidationResult result = standardValidator.validate(standardOrder);
        checks.add(new TestCheck("Validation Works", result.valid(),
            "Standard validator returned valid=" + result.valid()));

        return PatternTestResponse.of(patternName(), checks);
    }

    private ValidatedOrder validate(String orderType, Order order) {
        OrderValidator validator = validatorFactory.createValidator(order);
        ValidationResult result = validator.validate(order);
        return new ValidatedOrder(orderType, order.value(), validator.getValidatorType(), result.valid(), result.errors());
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

    public record ValidatedOrder(String orderType, BigDecimal orderValue, String validatorType,
                                 boolean valid, List<String> errors) {
    }
}
