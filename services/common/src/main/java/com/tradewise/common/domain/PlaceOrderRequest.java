package com.tradewise.common.domain;

import java.math.BigDecimal;

/**
 * Client intent to place an order. A null limit price means a market order.
 */
public record PlaceOrderRequest(String accountId, String symbol, OrderSide side, long quantity, BigDecimal limitPrice) {
}
