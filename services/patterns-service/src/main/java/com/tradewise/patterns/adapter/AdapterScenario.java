package com.tradewise.patterns.adapter;

import com.tradewise.common.domain.Quote;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
public class AdapterScenario implements PatternScenario {

    private static final long QUOTE_TIMEOUT_SECONDS = 5;

    private final ModernMarketDataProvider marketDataProvider;

    @Override
    public String slug() {
        return "adapter";
    }

    @Override
    public String patternName() {
        return "Adapter";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<AdaptedQuote> results = new ArrayList<>();
        for (String symbol : List.of("AAPL", "MSFT", "GOOGL")) {
            Quote quote = fetch(symbol);
            results.add(new AdaptedQuote(symbol, quote, quote.spread()));
        }

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates adapter pattern: legacy market data provider adapted to modern async interface.")
            .result(results)
            .metadata(Map.of(
                "LegacyToModern", true,
                "AsyncAdaptation", true))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        Quote quote = fetch("TEST");
        checks.add(new TestCheck("Adapter Returns Quote", "TEST".equals(quote.symbol()),
            "Retrieved quote for " + quote.symbol()));

        boolean pricesValid = quote.bid().signum() > 0 && quote.ask().compareTo(quote.bid()) > 0;
        checks.add(new TestCheck("Quote Values Valid", pricesValid,
            String.format("Bid=%s, Ask=%s, Spread=%s", quote.bid(), quote.ask(), quote.spread())));

        Duration age = Duration.between(quote.timestamp(), Instant.now());
        checks.add(new TestCheck("Quote Timestamp Recent", age.toMillis() < 5000,
            String.format("Timestamp is %.2f seconds ago", age.toMillis() / 1000.0)));

        return PatternTestResponse.of(patternName(), checks);
    }

    private Quote fetch(String symbol) {
        return marketDataProvider.getQuote(symbol)
            .orTimeout(QUOTE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .join();
    }

    public record AdaptedQuote(String symbol, Quote quote, BigDecimal spread) {
    }
}
