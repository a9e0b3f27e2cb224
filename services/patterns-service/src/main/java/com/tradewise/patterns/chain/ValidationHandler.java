package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Order;
import com.tradewise.patterns.factorymethod.ValidationResult;

/**
 * One link of an order validation pipeline.
 */
public interface ValidationHandler {

    /**
     * Appends a handler after this one.
     *
     * @return the appended handler, so links can be chained fluently
     */
    ValidationHandler setNext(ValidationHandler next);

    /**
     * Validates the order here and, only if that passes, hands it down the chain.
     */
    ValidationResult handle(Order order);
}
