package com.tradewise.common.domain;

public record CancelOrderRequest(String orderId, String accountId) {
}
