package com.tradewise.patterns.state;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderStatus;
import com.tradewise.patterns.exception.InvalidStateTransitionException;

/**
 * Lifecycle behaviour of an order in one status. Each operation returns the transitioned copy
 * or throws {@link InvalidStateTransitionException} when the status does not allow it.
 */
public interface OrderState {

    OrderStatus getStatus();

    Order place(Order order);

    Order fill(Order order, long filledQuantity);

    Order cancel(Order order, String reason);

    Order reject(Order order, String reason);

    default InvalidStateTransitionException invalid(String operation, String message) {
        return new InvalidStateTransitionException(getStatus(), operation, message);
    }
}
