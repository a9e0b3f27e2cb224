package com.tradewise.patterns.factorymethod;

import com.tradewise.common.domain.Order;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Field-level checks shared by every order size.
 */
public class StandardOrderValidator implements OrderValidator {

    public static final String TYPE = "Standard";

    @Override
    public ValidationResult validate(Order order) {
        return ValidationResult.of(basicErrors(order), getValidatorType());
    }

    @Override
    public String getValidatorType() {
        return TYPE;
    }

    protected List<String> basicErrors(Order order) {
        List<String> errors = new ArrayList<>();
        if (order.getQuantity() <= 0) {
            errors.add("Quantity must be greater than zero");
        }
        if (order.getPrice().compareTo(BigDecimal.ZERO) <= 0) {
            errors.add("Price must be greater than zero");
        }
        if (order.getSymbol() == null || order.getSymbol().isBlank()) {
            errors.add("Symbol is required");
        }
        return errors;
    }
}
