package com.tradewise.patterns.strategy;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.Quote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@org.springframework.core.annotation.Order(1)
public class MarketPriceStrategy implements PricingStrategy {

    public static final String NAME = "MarketPrice";

    @Override
    public String getStrategyName() {
        return NAME;
    }

    @Override
    public BigDecimal calculatePrice(Order order, Quote marketQuote) {
        return PricingStrategy.marketPrice(order, marketQuote);
    }
}
