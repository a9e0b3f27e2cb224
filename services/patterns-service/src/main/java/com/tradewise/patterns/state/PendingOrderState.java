package com.tradewise.patterns.state;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderStatus;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PendingOrderState implements OrderState {

    @Override
    public OrderStatus getStatus() {
        return OrderStatus.PENDING;
    }

    @Override
    public Order place(Order order) {
        return order.withStatus(OrderStatus.PLACED);
    }

    @Override
    public Order fill(Order order, long filledQuantity) {
        throw invalid("fill", "Cannot fill order in Pending state. Must place order first.");
    }

    @Override
    public Order cancel(Order order, String reason) {
        log.info("Cancelling pending order {}: {}", order.getOrderId(), reason);
        return order.withStatus(OrderStatus.CANCELLED);
    }

    @Override
    public Order reject(Order order, String reason) {
        log.info("Rejecting pending order {}: {}", order.getOrderId(), reason);
        return order.withStatus(OrderStatus.REJECTED);
    }
}
