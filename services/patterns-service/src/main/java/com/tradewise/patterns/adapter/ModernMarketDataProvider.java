package com.tradewise.patterns.adapter;

import com.tradewise.common.domain.Quote;

import java.util.concurrent.CompletableFuture;

public interface ModernMarketDataProvider {

    CompletableFuture<Quote> getQuote(String symbol);
}
