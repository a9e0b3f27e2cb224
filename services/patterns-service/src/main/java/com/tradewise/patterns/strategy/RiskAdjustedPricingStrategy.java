package com.tradewise.patterns.strategy;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.Quote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Market price plus a risk premium. Orders worth more than 100,000 at market pay 1.5x the premium.
 */
@Component
@org.springframework.core.annotation.Order(4)
public class RiskAdjustedPricingStrategy implements PricingStrategy {

    public static final String NAME = "RiskAdjusted";

    private static final BigDecimal DEFAULT_RISK_PREMIUM = new BigDecimal("0.02");
    private static final BigDecimal HIGH_VALUE_THRESHOLD = new BigDecimal("100000");
    private static final BigDecimal HIGH_VALUE_MULTIPLIER = new BigDecimal("1.5");

    private final BigDecimal riskPremium;

    public RiskAdjustedPricingStrategy() {
        this(DEFAULT_RISK_PREMIUM);
    }

    public RiskAdjustedPricingStrategy(BigDecimal riskPremium) {
        this.riskPremium = riskPremium;
    }

    @Override
    public String getStrategyName() {
        return NAME;
    }

    @Override
    public BigDecimal calculatePrice(Order order, Quote marketQuote) {
        BigDecimal basePrice = PricingStrategy.marketPrice(order, marketQuote);
        BigDecimal orderValue = basePrice.multiply(BigDecimal.valueOf(order.getQuantity()));
        BigDecimal multiplier = orderValue.compareTo(HIGH_VALUE_THRESHOLD) > 0 ? HIGH_VALUE_MULTIPLIER : BigDecimal.ONE;
        return basePrice.multiply(BigDecimal.ONE.add(riskPremium.multiply(multiplier)));
    }
}
