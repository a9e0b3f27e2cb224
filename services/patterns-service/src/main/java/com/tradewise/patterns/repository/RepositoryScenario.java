package com.tradewise.patterns.repository;

import com.tradewise.common.domain.LedgerEntry;
import com.tradewise.common.domain.Money;
import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.OrderStatus;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class RepositoryScenario implements PatternScenario {

    private final Repository<Order, String> orderStore;
    private final Repository<LedgerEntry, String> ledgerRepository;
    private final ObjectProvider<UnitOfWork> unitOfWorkProvider;

    @Override
    public String slug() {
        return "repository";
    }

    @Override
    public String patternName() {
        return "Repository";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();

        Order order = order("ORD-REPO-001", "ACC-001", "AAPL", OrderSide.BUY, 100, "150");
        orderStore.add(order);
        results.add(Map.of("action", "Add Order", "order", order));

        Optional<Order> retrieved = orderStore.findById(order.getOrderId());
        results.add(Map.of("action", "Retrieve Order", "found", retrieved.isPresent(), "orderId", order.getOrderId()));

        retrieved.ifPresent(found -> {
            Order placed = found.withStatus(OrderStatus.PLACED);
            orderStore.update(placed);
            results.add(Map.of("action", "Update Order", "orderId", placed.getOrderId(), "newStatus", placed.getStatus()));
        });

        Order second = order("ORD-REPO-002", "ACC-001", "MSFT", OrderSide.SELL, 50, "300");
        UnitOfWork unitOfWork = unitOfWorkProvider.getObject();
        unitOfWork.begin();
        unitOfWork.registerChange(() -> orderStore.add(second));
        unitOfWork.registerChange(() -> ledgerRepository.add(ledgerEntry("LED-REPO-002", "ACC-001", second.value(), LedgerEntry.EntryType.CREDIT)));
        int applied = unitOfWork.saveChanges();
        unitOfWork.commit();
        results.add(Map.of(
            "action", "Unit of Work",
            "description", "Order and ledger entry saved together",
            "orderId", second.getOrderId(),
            "changesApplied", applied));

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates repository pattern: abstracts data access, enables testing. Includes Unit of Work for transaction coordination.")
            .result(results)
            .metadata(Map.of(
                "Abstraction", "Data access abstracted from business logic",
                "Testability", "Easy to mock or use in-memory implementation",
                "UnitOfWork", "Coordinates multiple repository operations in transactions"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        Order order = order("ORD-TEST-001", "ACC-TEST", "TEST", OrderSide.BUY, 10, "100");
        orderStore.add(order);
        Optional<Order> retrieved = orderStore.findById(order.getOrderId());
        checks.add(new TestCheck("Repository Add and Retrieve",
            retrieved.map(Order::getOrderId).filter(order.getOrderId()::equals).isPresent(),
            "Retrieved order " + retrieved.map(Order::getOrderId).orElse(null)));

        orderStore.update(order.withStatus(OrderStatus.PLACED));
        Optional<OrderStatus> status = orderStore.findById(order.getOrderId()).map(Order::getStatus);
        checks.add(new TestCheck("Repository Update", status.filter(OrderStatus.PLACED::equals).isPresent(),
            "Updated order status to " + status.orElse(null)));

        orderStore.delete(order.getOrderId());
        checks.add(new TestCheck("Repository Delete", !orderStore.exists(order.getOrderId()), "Order was deleted"));

        Order deferred = order("ORD-TEST-002", "ACC-TEST", "TEST", OrderSide.BUY, 10, "100");
        UnitOfWork unitOfWork = unitOfWorkProvider.getObject();
        unitOfWork.begin();
        unitOfWork.registerChange(() -> orderStore.add(deferred));
        boolean deferredUntilSave = !orderStore.exists(deferred.getOrderId());
        unitOfWork.saveChanges();
        unitOfWork.commit();
        checks.add(new TestCheck("Unit of Work",
            deferredUntilSave && orderStore.exists(deferred.getOrderId()),
            "Unit of Work saved order " + deferred.getOrderId()));
        orderStore.delete(deferred.getOrderId());

        return PatternTestResponse.of(patternName(), checks);
    }

    private static Order order(String orderId, String accountId, String symbol, OrderSide side, long quantity, String price) {
        return Order.builder()
            .orderId(orderId)
            .accountId(accountId)
            .symbol(symbol)
            .side(side)
            .quantity(quantity)
            .price(new BigDecimal(price))
            .build();
    }

    private static LedgerEntry ledgerEntry(String entryId, String accountId, BigDecimal amount, LedgerEntry.EntryType type) {
        return new LedgerEntry(entryId, accountId, Money.of(amount, "USD"), type, Instant.now());
    }
}
