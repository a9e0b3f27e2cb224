package com.tradewise.patterns.facade;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradewise.common.domain.Order;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaceOrderResult(boolean success, Order order, List<String> errors) {

    public static PlaceOrderResult placed(Order order) {
        return new PlaceOrderResult(true, order, null);
    }

    public static PlaceOrderResult rejected(List<String> errors) {
        return new PlaceOrderResult(false, null, List.copyOf(errors));
    }
}
