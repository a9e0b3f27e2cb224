package com.tradewise.patterns.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables for the pattern demonstrations, bound from {@code tradewise.patterns.*}
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradewise.patterns")
public class PatternsProperties {

    private SingletonConfig singleton = new SingletonConfig();

    private FactoryMethodConfig factoryMethod = new FactoryMethodConfig();

    private RetryPolicy command = new RetryPolicy();

    private RetryPolicy decorator = new RetryPolicy();

    /**
     * Fake gateways used by the decorator and abstract factory demos
     */
    private GatewaysConfig gateways = new GatewaysConfig();

    /**
     * Providers registered with the payment provider resolver
     */
    private ProvidersConfig providers = new ProvidersConfig();

    private Simulation marketData = new Simulation(50L, Duration.ZERO);

    private ChainConfig chain = new ChainConfig();

    @Data
    public static class SingletonConfig {
        private Map<String, String> settings = defaultSettings();

        private static Map<String, String> defaultSettings() {
            Map<String, String> settings = new LinkedHashMap<>();
            settings.put("TradingApiUrl", "https://api.trading.example.com");
            settings.put("RiskCheckEnabled", "true");
            settings.put("MaxOrderSize", "1000000");
            settings.put("DefaultCurrency", "USD");
            settings.put("KafkaBootstrapServers", "localhost:9092");
            return settings;
        }
    }

    @Data
    public static class FactoryMethodConfig {
        /**
         * Orders at or above this value get the large-order validator
         */
        private BigDecimal largeOrderThreshold = new BigDecimal("100000");
    }

    @Data
    public static class RetryPolicy {
        private int maxAttempts = 3;

        /**
         * Base wait; attempt n waits n times this value
         */
        private Duration backoff = Duration.ofMillis(100);
    }

    @Data
    public static class GatewaysConfig {
        private Simulation stripe = new Simulation(42L, Duration.ofMillis(50));
        private Simulation paypal = new Simulation(43L, Duration.ofMillis(80));
    }

    @Data
    public static class ProvidersConfig {
        private Simulation stripe = new Simulation(42L, Duration.ofMillis(50));
        private Simulation paypal = new Simulation(43L, Duration.ofMillis(80));
        private Simulation crypto = new Simulation(44L, Duration.ofMillis(200));
    }

    @Data
    public static class ChainConfig {
        private BigDecimal maxOrderValue = new BigDecimal("1000000");
    }

    /**
     * Seed and latency of a simulated remote call
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Simulation {
        private long seed;
        private Duration latency = Duration.ZERO;
    }
}
