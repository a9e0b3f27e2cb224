package com.tradewise.patterns.command;

import com.tradewise.common.domain.Order;

import java.util.Optional;

/**
 * Order store used by commands; add and update both overwrite by order id.
 */
public interface OrderRepository {

    Optional<Order> findById(String orderId);

    void add(Order order);

    void update(Order order);

    void delete(String orderId);
}
