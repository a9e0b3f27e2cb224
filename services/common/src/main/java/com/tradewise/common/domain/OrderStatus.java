package com.tradewise.common.domain;

/**
 * Lifecycle of an order: PENDING -> PLACED -> PARTIALLY_FILLED/FILLED, or -> CANCELLED/REJECTED.
 */
public enum OrderStatus {
    PENDING,
    VALIDATED,
    PLACED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }
}
