package com.tradewise.patterns.strategy;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.Quote;

import java.math.BigDecimal;

/**
 * Pricing algorithm selectable at runtime.
 */
public interface PricingStrategy {

    String getStrategyName();

    BigDecimal calculatePrice(Order order, Quote marketQuote);

    /**
     * Ask for buys, bid for sells.
     */
    static BigDecimal marketPrice(Order order, Quote marketQuote) {
        return order.getSide() == OrderSide.BUY ? marketQuote.ask() : marketQuote.bid();
    }
}
