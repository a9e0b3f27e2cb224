package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Order;
import com.tradewise.patterns.factorymethod.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public abstract class AbstractValidationHandler implements ValidationHandler {

    private ValidationHandler next;

    @Override
    public ValidationHandler setNext(ValidationHandler next) {
        this.next = next;
        return next;
    }

    @Override
    public ValidationResult handle(Order order) {
        ValidationResult result = ValidationResult.of(validate(order), getHandlerName());
        if (!result.valid()) {
            log.info("Order {} stopped by {} validation: {}", order.getOrderId(), getHandlerName(), result.errors());
            return result;
        }
        return next != null ? next.handle(order) : result;
    }

    protected abstract String getHandlerName();

    /**
     * @return errors found by this link; empty when the order passes
     */
    protected abstract List<String> validate(Order order);
}
