package com.tradewise.patterns.factorymethod;

import com.tradewise.common.domain.Order;
import com.tradewise.patterns.config.PatternsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Picks the validator for an order from its notional value.
 */
@Slf4j
@Component
public class OrderValidatorFactory {

    private final BigDecimal largeOrderThreshold;

    public OrderValidatorFactory(PatternsProperties properties) {
        this.largeOrderThreshold = properties.getFactoryMethod().getLargeOrderThreshold();
    }

    public OrderValidator createValidator(Order order) {
        if (order.value().compareTo(largeOrderThreshold) >= 0) {
            log.debug("Order {} valued {} uses large-order validation", order.getOrderId(), order.value());
            return new LargeOrderValidator(largeOrderThreshold);
        }
        return new StandardOrderValidator();
    }
}
