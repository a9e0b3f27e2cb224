package com.tradewise.patterns.prototype;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Orders, positions and cash of a portfolio at one moment. Cloning copies every order snapshot
 * and the positions map.
 */
@Getter
public class PortfolioSnapshot implements Prototype<PortfolioSnapshot> {

    private final List<OrderSnapshot> orders;
    private final Map<String, BigDecimal> positions;
    private final BigDecimal cashBalance;
    private final Instant snapshotTimestamp;

    public PortfolioSnapshot(List<OrderSnapshot> orders, Map<String, BigDecimal> positions, BigDecimal cashBalance) {
        this.orders = List.copyOf(orders);
        this.positions = new LinkedHashMap<>(positions);
        this.cashBalance = cashBalance;
        this.snapshotTimestamp = Instant.now();
    }

    @Override
    public PortfolioSnapshot deepClone() {
        List<OrderSnapshot> clonedOrders = orders.stream()
            .map(OrderSnapshot::deepClone)
            .collect(Collectors.toList());
        return new PortfolioSnapshot(clonedOrders, positions, cashBalance);
    }
}
