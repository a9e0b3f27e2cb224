package com.tradewise.patterns.facade;

import com.tradewise.common.domain.CancelOrderRequest;
import com.tradewise.common.domain.PlaceOrderRequest;

/**
 * Single entry point for order placement and cancellation. Validation, persistence and
 * event publication happen behind it; failures come back as results, never as exceptions.
 */
public interface TradingFacade {

    PlaceOrderResult placeOrder(PlaceOrderRequest request);

    CancelOrderResult cancelOrder(CancelOrderRequest request);
}
