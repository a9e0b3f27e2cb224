package com.tradewise.patterns.prototype;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class PrototypeScenario implements PatternScenario {

    @Override
    public String slug() {
        return "prototype";
    }

    @Override
    public String patternName() {
        return "Prototype";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();

        OrderSnapshot original = new OrderSnapshot(order("ORD-PROTO-001", "ACC-001", "AAPL", 100, "150"),
            Map.of("BacktestId", "BT-001", "Strategy", "Momentum"));
        results.add(new SnapshotView("Original Snapshot", original, null));

        OrderSnapshot clone = original.deepClone();
        clone.getMetadata().put("BacktestId", "BT-002");
        results.add(new SnapshotView("Cloned Snapshot", clone,
            "Clone is independent - modifying clone doesn't affect original"));

        PortfolioSnapshot portfolio = new PortfolioSnapshot(List.of(original, clone),
            Map.of("AAPL", new BigDecimal("200")), new BigDecimal("10000"));
        PortfolioSnapshot clonedPortfolio = portfolio.deepClone();
        clonedPortfolio.getPositions().put("AAPL", new BigDecimal("300"));
        results.add(Map.of(
            "action", "Portfolio Clone",
            "originalPositions", portfolio.getPositions(),
            "clonedPositions", clonedPortfolio.getPositions(),
            "note", "Portfolio clone is independent"));

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates prototype pattern: creates deep copies of objects for snapshots, backtests, and cloning scenarios.")
            .result(results)
            .metadata(Map.of(
                "UseCase", "Backtesting, snapshots, cloning",
                "DeepCopy", true,
                "Independence", "Clones are independent of originals"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        OrderSnapshot original = new OrderSnapshot(order("ORD-TEST", "ACC-TEST", "TEST", 10, "100"));
        OrderSnapshot clone = original.deepClone();
        checks.add(new TestCheck("Clone Creates Copy",
            clone != original && clone.getOrder().getOrderId().equals(original.getOrder().getOrderId()),
            "Cloned snapshot with order " + clone.getOrder().getOrderId()));

        clone.getMetadata().put("Test", "Modified");
        checks.add(new TestCheck("Clone Independence", !original.getMetadata().containsKey("Test"),
            "Modifying clone doesn't affect original"));

        PortfolioSnapshot portfolio = new PortfolioSnapshot(List.of(original),
            Map.of("TEST", BigDecimal.TEN), new BigDecimal("1000"));
        PortfolioSnapshot clonedPortfolio = portfolio.deepClone();
        clonedPortfolio.getPositions().put("TEST", new BigDecimal("20"));
        checks.add(new TestCheck("Portfolio Clone",
            portfolio.getPositions().get("TEST").compareTo(BigDecimal.TEN) == 0
                && clonedPortfolio.getPositions().get("TEST").compareTo(new BigDecimal("20")) == 0,
            "Portfolio clone is independent"));

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

    public record SnapshotView(String action, String orderId, Instant snapshotTimestamp,
                               Map<String, Object> metadata, String note) {

        SnapshotView(String action, OrderSnapshot snapshot, String note) {
            this(action, snapshot.getOrder().getOrderId(), snapshot.getSnapshotTimestamp(),
                Map.copyOf(snapshot.getMetadata()), note);
        }
    }
}
