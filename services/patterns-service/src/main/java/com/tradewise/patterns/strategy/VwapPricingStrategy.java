package com.tradewise.patterns.strategy;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.Quote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Simplified volume-weighted price: mid plus a tenth of the spread, with a small
 * improvement for block-sized orders.
 */
@Component
@org.springframework.core.annotation.Order(3)
public class VwapPricingStrategy implements PricingStrategy {

    public static final String NAME = "VWAP";

    static final long BLOCK_QUANTITY = 1000;

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal SPREAD_WEIGHT = new BigDecimal("0.1");
    private static final BigDecimal BLOCK_ADJUSTMENT = new BigDecimal("-0.001");

    @Override
    public String getStrategyName() {
        return NAME;
    }

    @Override
    public BigDecimal calculatePrice(Order order, Quote marketQuote) {
        BigDecimal mid = marketQuote.bid().add(marketQuote.ask()).divide(TWO);
        BigDecimal price = mid.add(marketQuote.spread().multiply(SPREAD_WEIGHT));
        return order.getQuantity() > BLOCK_QUANTITY ? price.add(BLOCK_ADJUSTMENT) : price;
    }
}
