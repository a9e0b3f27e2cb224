package com.tradewise.patterns.factorymethod;

import com.tradewise.common.domain.Order;

public interface OrderValidator {

    ValidationResult validate(Order order);

    String getValidatorType();
}
