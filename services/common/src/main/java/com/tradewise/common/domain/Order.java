package com.tradewise.common.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable trading order. Transitions produce a new copy through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class Order {

    @NonNull
    String orderId;

    String accountId;

    String symbol;

    OrderSide side;

    long quantity;

    @Builder.Default
    BigDecimal price = BigDecimal.ZERO;

    @Builder.Default
    OrderStatus status = OrderStatus.PENDING;

    @Builder.Default
    Instant createdAt = Instant.now();

    Instant updatedAt;

    /**
     * Optimistic concurrency counter, bumped on every stored modification.
     */
    int rowVersion;

    /**
     * Notional value of the order (quantity × price).
     */
    public BigDecimal value() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    public Order withStatus(OrderStatus newStatus) {
        return toBuilder()
                .status(newStatus)
                .updatedAt(Instant.now())
                .rowVersion(rowVersion + 1)
                .build();
    }
}
