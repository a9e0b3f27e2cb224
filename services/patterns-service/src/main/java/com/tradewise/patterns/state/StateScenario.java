package com.tradewise.patterns.state;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.OrderStatus;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.exception.InvalidStateTransitionException;
import com.tradewise.patterns.scenario.PatternScenario;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class StateScenario implements PatternScenario {

    @Override
    public String slug() {
        return "state";
    }

    @Override
    public String patternName() {
        return "State";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();

        Order order = order("ORD-STATE-001", "ACC-001", "AAPL", 100, "150");
        OrderState state = OrderStateFactory.forStatus(order.getStatus());
        results.add(new Transition("Initial", state.getStatus(), order));

        order = state.place(order);
        state = OrderStateFactory.forStatus(order.getStatus());
        results.add(new Transition("Place", state.getStatus(), order));

        order = state.fill(order, 100);
        state = OrderStateFactory.forStatus(order.getStatus());
        results.add(new Transition("Fill", state.getStatus(), order));

        try {
            state.cancel(order, "Test");
            results.add(new RejectedTransition("Invalid Cancel", false, "Should have thrown exception"));
        } catch (InvalidStateTransitionException e) {
            results.add(new RejectedTransition("Invalid Cancel", true, e.getMessage()));
        }

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates state pattern: encapsulates order lifecycle state transitions with validation.")
            .result(results)
            .metadata(Map.of(
                "StateTransitions", "Pending -> Placed -> Filled/Cancelled",
                "TerminalStates", List.of("Filled", "Cancelled", "Rejected"),
                "Validation", "Invalid transitions throw exceptions"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        Order order = OrderStateFactory.forStatus(OrderStatus.PENDING)
            .place(order("ORD-TEST", "ACC-TEST", "TEST", 10, "100"));
        checks.add(new TestCheck("Pending to Placed Transition", order.getStatus() == OrderStatus.PLACED,
            "Order status: " + order.getStatus()));

        order = OrderStateFactory.forStatus(order.getStatus()).fill(order, 10);
        checks.add(new TestCheck("Placed to Filled Transition", order.getStatus() == OrderStatus.FILLED,
            "Order status: " + order.getStatus()));

        boolean prevented;
        try {
            OrderStateFactory.forStatus(order.getStatus()).cancel(order, "Test");
            prevented = false;
        } catch (InvalidStateTransitionException e) {
            prevented = true;
        }
        checks.add(new TestCheck("Invalid Transition Prevention", prevented,
            prevented ? "Invalid transition correctly prevented" : "Should have thrown exception"));

        return PatternTestResponse.of(patternName(), checks);
    }

    private static Order order(String orderId, String accountId, String symbol, long quantity, String price) {
        return Order.builder()
            .orderId(orderId)
            .accountId(accountId)
            .symbol(symbol)
            .side(OrderSide.BUY)
            .quantity(quantity)
            .price(new BigDecimal(price))
            .build();
    }

    public record Transition(String step, OrderStatus state, Order order) {
    }

    public record RejectedTransition(String step, boolean success, String message) {
    }
}
