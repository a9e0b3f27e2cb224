package com.tradewise.patterns.command;

import com.tradewise.common.domain.Order;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public void add(Order order) {
        orders.put(order.getOrderId(), order);
    }

    @Override
    public void update(Order order) {
        orders.put(order.getOrderId(), order);
    }

    @Override
    public void delete(String orderId) {
        orders.remove(orderId);
    }
}
