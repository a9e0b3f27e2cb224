package com.tradewise.patterns.adapter;

import com.tradewise.common.domain.Quote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Exposes the blocking legacy feed through the asynchronous {@link ModernMarketDataProvider} contract.
 */
@Slf4j
@Component
public class MarketDataAdapter implements ModernMarketDataProvider {

    private final LegacyMarketDataProvider legacyProvider;
    private final Executor executor;

    public MarketDataAdapter(LegacyMarketDataProvider legacyProvider,
                             @Qualifier("applicationTaskExecutor") Executor executor) {
        this.legacyProvider = legacyProvider;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Quote> getQuote(String symbol) {
        return CompletableFuture.supplyAsync(() -> legacyProvider.getQuoteLegacy(symbol), executor)
            .thenApply(this::toQuote);
    }

    private Quote toQuote(LegacyQuote legacy) {
        log.debug("Adapting legacy quote for {}", legacy.symbol());
        return new Quote(
            legacy.symbol(),
            BigDecimal.valueOf(legacy.bid()),
            BigDecimal.valueOf(legacy.ask()),
            BigDecimal.valueOf((legacy.bid() + legacy.ask()) / 2),
            Instant.ofEpochMilli(legacy.epochMillis()));
    }
}
