package com.tradewise.common.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Top-of-book market quote.
 */
public record Quote(String symbol, BigDecimal bid, BigDecimal ask, BigDecimal last, Instant timestamp) {

    public BigDecimal mid() {
        return bid.add(ask).divide(BigDecimal.valueOf(2), 8, RoundingMode.HALF_UP);
    }

    public BigDecimal spread() {
        return ask.subtract(bid);
    }
}
