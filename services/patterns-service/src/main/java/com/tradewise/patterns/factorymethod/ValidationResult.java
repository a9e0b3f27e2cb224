package com.tradewise.patterns.factorymethod;

import java.util.List;

/**
 * Outcome of validating an order. Failures are reported here, never thrown.
 */
public record ValidationResult(boolean valid, List<String> errors, String validatorType) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors, String validatorType) {
        return new ValidationResult(errors.isEmpty(), errors, validatorType);
    }
}
