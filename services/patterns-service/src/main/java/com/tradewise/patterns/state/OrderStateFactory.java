package com.tradewise.patterns.state;

import com.tradewise.common.domain.OrderStatus;

/**
 * Maps an order status to its state object. States are stateless and shared.
 * Statuses without dedicated behaviour fall back to Pending.
 */
public final class OrderStateFactory {

    private static final OrderState PENDING = new PendingOrderState();
    private static final OrderState PLACED = new PlacedOrderState();
    private static final OrderState FILLED = new FilledOrderState();
    private static final OrderState CANCELLED = new CancelledOrderState();

    private OrderStateFactory() {
    }

    public static OrderState forStatus(OrderStatus status) {
        return switch (status) {
            case PLACED -> PLACED;
            case FILLED -> FILLED;
            case CANCELLED -> CANCELLED;
            default -> PENDING;
        };
    }
}
