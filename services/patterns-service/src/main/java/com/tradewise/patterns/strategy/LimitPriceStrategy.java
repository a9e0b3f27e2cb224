package com.tradewise.patterns.strategy;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.Quote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Uses the order's own price when it carries one that differs from the last trade,
 * otherwise falls back to the market side.
 */
@Component
@org.springframework.core.annotation.Order(2)
public class LimitPriceStrategy implements PricingStrategy {

    public static final String NAME = "LimitPrice";

    @Override
    public String getStrategyName() {
        return NAME;
    }

    @Override
    public BigDecimal calculatePrice(Order order, Quote marketQuote) {
        BigDecimal limit = order.getPrice();
        if (limit.signum() > 0 && limit.compareTo(marketQuote.last()) != 0) {
            return limit;
        }
        return PricingStrategy.marketPrice(order, marketQuote);
    }
}
