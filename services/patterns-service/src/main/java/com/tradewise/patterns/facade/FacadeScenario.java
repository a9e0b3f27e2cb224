package com.tradewise.patterns.facade;

import com.tradewise.common.domain.CancelOrderRequest;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.PlaceOrderRequest;
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
public class FacadeScenario implements PatternScenario {

    private final TradingFacade tradingFacade;

    @Override
    public String slug() {
        return "facade";
    }

    @Override
    public String patternName() {
        return "Facade";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();

        PlaceOrderRequest placeRequest = new PlaceOrderRequest("ACC-001", "AAPL", OrderSide.BUY, 100, new BigDecimal("150"));
        PlaceOrderResult placeResult = tradingFacade.placeOrder(placeRequest);
        results.add(new FacadeCall("Place Order", placeRequest, placeResult));

        if (placeResult.success()) {
            CancelOrderRequest cancelRequest = new CancelOrderRequest(placeResult.order().getOrderId(), "ACC-001");
            results.add(new FacadeCall("Cancel Order", cancelRequest, tradingFacade.cancelOrder(cancelRequest)));
        }

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates facade pattern: simplifies complex trading subsystem (validation, repository, commands, events) behind simple interface.")
            .result(results)
            .metadata(Map.of(
                "SubsystemComponents", List.of("Validator", "Repository", "CommandHandler", "EventBus"),
                "SimplifiedInterface", true))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        PlaceOrderResult placed = tradingFacade.placeOrder(
            new PlaceOrderRequest("ACC-TEST", "TEST", OrderSide.BUY, 10, new BigDecimal("100")));
        checks.add(new TestCheck("Facade Places Order", placed.success() && placed.order() != null,
            "Order placed: " + (placed.order() != null ? placed.order().getOrderId() : null)));

        PlaceOrderResult invalid = tradingFacade.placeOrder(
            new PlaceOrderRequest("ACC-TEST", "", OrderSide.BUY, -10, new BigDecimal("100")));
        checks.add(new TestCheck("Facade Validates Orders",
            !invalid.success() && invalid.errors() != null && !invalid.errors().isEmpty(),
            "Validation errors: " + (invalid.errors() != null ? String.join(", ", invalid.errors()) : "")));

        if (placed.success()) {
            CancelOrderResult cancelled = tradingFacade.cancelOrder(
                new CancelOrderRequest(placed.order().getOrderId(), "ACC-TEST"));
            checks.add(new TestCheck("Facade Cancels Orders", cancelled.success(),
                "Order cancelled: " + cancelled.success()));
        }

        return PatternTestResponse.of(patternName(), checks);
    }

    public record FacadeCall(String action, Object request, Object result) {
    }
}
