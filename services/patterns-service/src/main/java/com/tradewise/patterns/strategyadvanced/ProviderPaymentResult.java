package com.tradewise.patterns.strategyadvanced;

import java.time.Instant;

/**
 * Outcome reported by a {@link PaymentProvider}. Status is {@value #SUCCESS} or {@value #FAILED}.
 */
public record ProviderPaymentResult(String transactionId, String status, String providerUsed,
                                    Instant processedAt, String message) {

    public static final String SUCCESS = "Success";
    public static final String FAILED = "Failed";

    public boolean successful() {
        return SUCCESS.equals(status);
    }
}
