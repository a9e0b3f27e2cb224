package com.tradewise.patterns.state;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderStatus;

/**
 * Terminal.
 */
public class FilledOrderState implements OrderState {

    @Override
    public OrderStatus getStatus() {
        return OrderStatus.FILLED;
    }

    @Override
    public Order place(Order order) {
        throw invalid("place", "Cannot place order in Filled state (terminal).");
    }

    @Override
    public Order fill(Order order, long filledQuantity) {
        throw invalid("fill", "Order is already filled.");
    }

    @Override
    public Order cancel(Order order, String reason) {
        throw invalid("cancel", "Cannot cancel order in Filled state (terminal).");
    }

    @Override
    public Order reject(Order order, String reason) {
        throw invalid("reject", "Cannot reject order in Filled state (terminal).");
    }
}
