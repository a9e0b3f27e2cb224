package com.tradewise.patterns.strategy;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.Quote;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class StrategyScenario implements PatternScenario {

    private final PricingStrategySelector selector;
    private final List<PricingStrategy> strategies;

    @Override
    public String slug() {
        return "strategy";
    }

    @Override
    public String patternName() {
        return "Strategy";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();
        Quote marketQuote = quote("AAPL", "150", "150.5", "150.25");

        for (PricingStrategy strategy : strategies) {
            Order order = order("ORD-" + strategy.getStrategyName(), "AAPL", 100, "150", "ACC-001");
            results.add(new PricedOrder(
                strategy.getStrategyName(),
                order.value(),
                strategy.calculatePrice(order, marketQuote),
                marketQuote.bid(),
                marketQuote.ask()));
        }

        Order largeOrder = order("ORD-LARGE", "MSFT", 10_000, "300", "ACC-001");
        PricingStrategy selected = selector.selectStrategy(largeOrder);
        results.add(new StrategySelection("Strategy Selection", largeOrder.value(), selected.getStrategyName()));

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates strategy pattern: different pricing algorithms selected at runtime based on order characteristics.")
            .result(results)
            .metadata(Map.of(
                "StrategyCount", strategies.size(),
                "RuntimeSelection", true))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();
        Quote marketQuote = quote("TEST", "100", "100.5", "100.25");
        Order order = order("ORD-TEST", "TEST", 10, "100", "ACC-TEST");

        for (PricingStrategy strategy : strategies) {
            BigDecimal price = strategy.calculatePrice(order, marketQuote);
            checks.add(new TestCheck(strategy.getStrategyName() + " Calculates Price", price.signum() > 0,
                strategy.getStrategyName() + " calculated price: " + price));
        }

        PricingStrategy selected = selector.selectStrategy(order);
        checks.add(new TestCheck("Strategy Selection", selected != null,
            "Selected strategy: " + selected.getStrategyName()));

        return PatternTestResponse.of(patternName(), checks);
    }

    private static Quote quote(String symbol, String bid, String ask, String last) {
        return new Quote(symbol, new BigDecimal(bid), new BigDecimal(ask), new BigDecimal(last), Instant.now());
    }

    private static Order order(String orderId, String symbol, long quantity, String price, String accountId) {
        return Order.builder()
            .orderId(orderId)
            .accountId(accountId)
            .symbol(symbol)
            .side(OrderSide.BUY)
            .quantity(quantity)
            .price(new BigDecimal(price))
            .build();
    }

    public record PricedOrder(String strategy, BigDecimal orderValue, BigDecimal calculatedPrice,
                              BigDecimal marketBid, BigDecimal marketAsk) {
    }

    public record StrategySelection(String selection, BigDecimal orderValue, String selectedStrategy) {
    }
}
