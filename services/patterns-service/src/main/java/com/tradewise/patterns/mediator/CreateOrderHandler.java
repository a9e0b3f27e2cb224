package com.tradewise.patterns.mediator;

import com.tradewise.common.domain.Order;
import com.tradewise.patterns.repository.Repository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class CreateOrderHandler implements RequestHandler<CreateOrderRequest, Order> {

    private final Repository<Order, String> orderStore;

    @Override
    public Class<CreateOrderRequest> requestType() {
        return CreateOrderRequest.class;
    }

    @Override
    public Order handle(CreateOrderRequest request) {
        Order order = Order.builder()
            .orderId("ORD-" + UUID.randomUUID().toString().replace("-", ""))
            .accountId(request.accountId())
            .symbol(request.symbol())
            .side(request.side())
            .quantity(request.quantity())
            .price(request.price())
            .build();

        orderStore.add(order);
        log.info("Created order {} via mediator", order.getOrderId());
        return order;
    }
}
