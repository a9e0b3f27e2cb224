package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Order;

import java.math.BigDecimal;
import java.util.List;

public class RiskValidationHandler extends AbstractValidationHandler {

    private final BigDecimal maxOrderValue;

    public RiskValidationHandler(BigDecimal maxOrderValue) {
        this.maxOrderValue = maxOrderValue;
    }

    @Override
    protected String getHandlerName() {
        return "Risk";
    }

    @Override
    protected List<String> validate(Order order) {
        BigDecimal orderValue = order.value();
        if (orderValue.compareTo(maxOrderValue) > 0) {
            return List.of(String.format("Order value %s exceeds maximum %s",
                orderValue.toPlainString(), maxOrderValue.toPlainString()));
        }
        return List.of();
    }
}
