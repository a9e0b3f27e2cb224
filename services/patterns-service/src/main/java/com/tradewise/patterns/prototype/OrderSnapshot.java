package com.tradewise.patterns.prototype;

import com.tradewise.common.domain.Order;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time copy of an order with free-form metadata (backtest id, strategy, ...).
 * The metadata map is mutable and owned by the snapshot.
 */
@Getter
public class OrderSnapshot implements Prototype<OrderSnapshot> {

    private final Order order;
    private final Map<String, Object> metadata;
    private final Instant snapshotTimestamp;

    public OrderSnapshot(Order order) {
        this(order, Map.of());
    }

    public OrderSnapshot(Order order, Map<String, Object> metadata) {
        this.order = order;
        this.metadata = new LinkedHashMap<>(metadata);
        this.snapshotTimestamp = Instant.now();
    }

    @Override
    public OrderSnapshot deepClone() {
        return new OrderSnapshot(order.toBuilder().build(), metadata);
    }
}
