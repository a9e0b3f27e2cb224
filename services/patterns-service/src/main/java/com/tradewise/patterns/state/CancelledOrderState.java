package com.tradewise.patterns.state;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderStatus;

/**
 * Terminal.
 */
public class CancelledOrderState implements OrderState {

    @Override
    public OrderStatus getStatus() {
        return OrderStatus.CANCELLED;
    }

    @Override
    public Order place(Order order) {
        throw invalid("place", "Cannot place order in Cancelled state (terminal).");
    }

    @Override
    public Order fill(Order order, long filledQuantity) {
        throw invalid("fill", "Cannot fill order in Cancelled state (terminal).");
    }

    @Override
    public Order cancel(Order order, String reason) {
        throw invalid("cancel", "Order is already cancelled.");
    }

    @Override
    public Order reject(Order order, String reason) {
        throw invalid("reject", "Cannot reject order in Cancelled state (terminal).");
    }
}
