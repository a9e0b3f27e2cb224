package com.tradewise.patterns.mediator;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;

import java.math.BigDecimal;

public record CreateOrderRequest(String accountId, String symbol, OrderSide side, long quantity, BigDecimal price)
        implements Request<Order> {
}
