package com.tradewise.patterns.facade;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelOrderResult(boolean success, String errorMessage) {

    public static CancelOrderResult cancelled() {
        return new CancelOrderResult(true, null);
    }

    public static CancelOrderResult failed(String errorMessage) {
        return new CancelOrderResult(false, errorMessage);
    }
}
