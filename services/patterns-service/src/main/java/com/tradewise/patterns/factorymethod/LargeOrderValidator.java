package com.tradewise.patterns.factorymethod;

import com.tradewise.common.domain.Order;

import java.math.BigDecimal;
import java.util.List;

/**
 * Adds a hard ceiling of ten times the large-order threshold on top of the standard checks.
 */
public class LargeOrderValidator extends StandardOrderValidator {

    public static final String TYPE = "LargeOrder";

    private final BigDecimal maximumValue;

    public LargeOrderValidator(BigDecimal threshold) {
        this.maximumValue = threshold.multiply(BigDecimal.TEN);
    }

    @Override
    public ValidationResult validate(Order order) {
        List<String> errors = basicErrors(order);
        if (order.value().compareTo(maximumValue) > 0) {
            errors.add("Order value exceeds maximum allowed (10x threshold)");
        }
        return ValidationResult.of(errors, getValidatorType());
    }

    @Override
    public String getValidatorType() {
        return TYPE;
    }
}
