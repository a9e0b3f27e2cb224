package com.tradewise.patterns.adapter;

import com.tradewise.common.domain.Quote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Market Data Adapter Unit Tests")
class MarketDataAdapterTest {

    @Test
    @DisplayName("Converts the legacy quote into the modern shape")
    void adaptsLegacyQuote() {
        LegacyMarketDataProvider legacy = new LegacyMarketDataProvider(new Random() {
            @Override
            public double nextDouble() {
                return 0.5;
            }
        });
        MarketDataAdapter adapter = new MarketDataAdapter(legacy, Runnable::run);

        Quote quote = adapter.getQuote("AAPL").join();

        assertThat(quote.symbol()).isEqualTo("AAPL");
        assertThat(quote.bid()).isEqualByComparingTo("124.5");
        assertThat(quote.ask()).isEqualByComparingTo("125.5");
        assertThat(quote.last()).isEqualByComparingTo("125");
        assertThat(quote.spread()).isEqualByComparingTo("1");
        assertThat(quote.timestamp()).isNotNull();
    }

    @Test
    @DisplayName("Seeded feed always quotes a positive spread")
    void seededFeed() {
        MarketDataAdapter adapter = new MarketDataAdapter(new LegacyMarketDataProvider(new Random(50)), Runnable::run);

        for (String symbol : new String[] {"AAPL", "MSFT", "GOOGL"}) {
            Quote quote = adapter.getQuote(symbol).join();
            assertThat(quote.bid()).isPositive();
            assertThat(quote.ask()).isGreaterThan(quote.bid());
        }
    }
}
