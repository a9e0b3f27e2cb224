package com.tradewise.patterns.state;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderStatus;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PlacedOrderState implements OrderState {

    @Override
    public OrderStatus getStatus() {
        return OrderStatus.PLACED;
    }

    @Override
    public Order place(Order order) {
        throw invalid("place", "Order is already placed.");
    }

    /**
     * A fill covering the whole quantity completes the order; anything less leaves it partially filled.
     */
    @Override
    public Order fill(Order order, long filledQuantity) {
        OrderStatus next = filledQuantity >= order.getQuantity() ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        return order.withStatus(next);
    }

    @Override
    public Order cancel(Order order, String reason) {
        log.info("Cancelling placed order {}: {}", order.getOrderId(), reason);
        return order.withStatus(OrderStatus.CANCELLED);
    }

    @Override
    public Order reject(Order order, String reason) {
        throw invalid("reject", "Cannot reject order in Placed state. Use Cancel instead.");
    }
}
