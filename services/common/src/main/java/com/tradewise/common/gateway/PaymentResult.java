package com.tradewise.common.gateway;

import java.time.Instant;

/**
 * Outcome of a gateway call. A declined payment is a result, not an exception.
 */
public record PaymentResult(boolean success, String transactionId, String errorMessage, Instant processedAt) {

    public static PaymentResult approved(String transactionId) {
        return new PaymentResult(true, transactionId, null, Instant.now());
    }

    public static PaymentResult declined(String transactionId, String errorMessage) {
        return new PaymentResult(false, transactionId, errorMessage, Instant.now());
    }
}
