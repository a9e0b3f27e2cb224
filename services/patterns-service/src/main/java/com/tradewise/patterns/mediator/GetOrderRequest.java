package com.tradewise.patterns.mediator;

import com.tradewise.common.domain.Order;

import java.util.Optional;

public record GetOrderRequest(String orderId) implements Request<Optional<Order>> {
}
