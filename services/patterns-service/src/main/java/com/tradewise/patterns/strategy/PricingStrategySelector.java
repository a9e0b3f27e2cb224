package com.tradewise.patterns.strategy;

import com.tradewise.common.domain.Order;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Picks a pricing strategy from the order's characteristics. Rules are checked most specific first:
 * <ol>
 *   <li>value above 500,000: RiskAdjusted</li>
 *   <li>order carries a price: LimitPrice</li>
 *   <li>quantity above 1,000: VWAP</li>
 *   <li>otherwise MarketPrice</li>
 * </ol>
 * Stateless, safe for concurrent use.
 */
@Slf4j
@Component
public class PricingStrategySelector {

    static final BigDecimal HIGH_VALUE_THRESHOLD = new BigDecimal("500000");

    private final Map<String, PricingStrategy> strategies;

    public PricingStrategySelector(List<PricingStrategy> strategies) {
        this.strategies = strategies.stream()
            .collect(Collectors.toUnmodifiableMap(PricingStrategy::getStrategyName, Function.identity()));
    }

    public PricingStrategy selectStrategy(Order order) {
        PricingStrategy selected;
        if (order.value().compareTo(HIGH_VALUE_THRESHOLD) > 0) {
            selected = strategy(RiskAdjustedPricingStrategy.NAME);
        } else if (order.getPrice().signum() > 0) {
            selected = strategy(LimitPriceStrategy.NAME);
        } else if (order.getQuantity() > VwapPricingStrategy.BLOCK_QUANTITY) {
            selected = strategy(VwapPricingStrategy.NAME);
        } else {
            selected = strategy(MarketPriceStrategy.NAME);
        }
        log.debug("Selected {} pricing for order {}", selected.getStrategyName(), order.getOrderId());
        return selected;
    }

    private PricingStrategy strategy(String name) {
        PricingStrategy strategy = strategies.get(name);
        if (strategy == null) {
            throw new IllegalStateException("Pricing strategy not registered: " + name);
        }
        return strategy;
    }
}
