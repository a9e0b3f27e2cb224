package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Order;
import com.tradewise.patterns.factorymethod.StandardOrderValidator;

import java.util.List;

/**
 * Field-level checks: quantity, price and symbol.
 */
public class BasicValidationHandler extends AbstractValidationHandler {

    private final StandardOrderValidator fieldValidator = new StandardOrderValidator();

    @Override
    protected String getHandlerName() {
        return "Basic";
    }

    @Override
    protected List<String> validate(Order order) {
        return fieldValidator.validate(order).errors();
    }
}
