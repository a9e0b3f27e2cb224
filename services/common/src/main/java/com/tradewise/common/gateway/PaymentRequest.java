package com.tradewise.common.gateway;

import java.math.BigDecimal;
import java.util.Map;

public record PaymentRequest(
        String transactionId,
        BigDecimal amount,
        String currency,
        String accountId,
        Map<String, String> metadata) {

    public PaymentRequest {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
