package com.tradewise.patterns.strategyadvanced;

import java.time.Instant;

/**
 * Error body of the provider endpoints.
 */
public record StrategyErrorResponse(String error, String providerKey, Instant timestamp) {
}
