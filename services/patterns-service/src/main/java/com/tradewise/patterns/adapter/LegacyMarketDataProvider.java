package com.tradewise.patterns.adapter;

import com.tradewise.patterns.config.PatternsProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Synchronous market data feed with its own quote format.
 */
@Component
public class LegacyMarketDataProvider {

    private final Random random;

    @Autowired
    public LegacyMarketDataProvider(PatternsProperties properties) {
        this(new Random(properties.getMarketData().getSeed()));
    }

    LegacyMarketDataProvider(Random random) {
        this.random = random;
    }

    public LegacyQuote getQuoteLegacy(String symbol) {
        double basePrice = 100.0 + random.nextDouble() * 50;
        return new LegacyQuote(symbol, basePrice - 0.5, basePrice + 0.5, System.currentTimeMillis());
    }
}
