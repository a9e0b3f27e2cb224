package com.tradewise.patterns.strategyadvanced;

import com.tradewise.common.gateway.SimulatedLatency;
import com.tradewise.patterns.config.PatternsProperties;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Provider that imitates a remote processor: validates against its limits, waits for the configured
 * latency and succeeds when the seeded generator draws above the failure threshold.
 */
@Slf4j
public abstract class SimulatedPaymentProvider implements PaymentProvider {

    static final String FAILURE_MESSAGE = "Payment processing failed";

    private final String providerKey;
    private final String displayName;
    private final BigDecimal minimumAmount;
    private final List<String> supportedCurrencies;
    private final double failureThreshold;
    private final Random random;
    private final Duration latency;

    protected SimulatedPaymentProvider(String providerKey, String displayName, BigDecimal minimumAmount,
                                       List<String> supportedCurrencies, double failureThreshold,
                                       PatternsProperties.Simulation simulation) {
        this.providerKey = providerKey;
        this.displayName = displayName;
        this.minimumAmount = minimumAmount;
        this.supportedCurrencies = List.copyOf(supportedCurrencies);
        this.failureThreshold = failureThreshold;
        this.random = new Random(simulation.getSeed());
        this.latency = simulation.getLatency();
    }

    @Override
    public String getProviderKey() {
        return providerKey;
    }

    @Override
    public BigDecimal getMinimumAmount() {
        return minimumAmount;
    }

    @Override
    public List<String> getSupportedCurrencies() {
        return supportedCurrencies;
    }

    @Override
    public boolean validatePayment(BigDecimal amount, String currency) {
        if (amount.compareTo(minimumAmount) < 0) {
            log.warn("Payment amount {} is below minimum {} for provider {}", amount, minimumAmount, providerKey);
            return false;
        }
        boolean supported = supportedCurrencies.stream().anyMatch(c -> c.equalsIgnoreCase(currency));
        if (!supported) {
            log.warn("Currency {} is not supported by provider {}", currency, providerKey);
        }
        return supported;
    }

    @Override
    public ProviderPaymentResult processPayment(BigDecimal amount, String currency, String customerEmail) {
        log.info("Processing payment via {}: amount={}, currency={}, email={}",
            displayName, amount, currency, customerEmail);

        SimulatedLatency.pause(latency);

        String transactionId = providerKey + "_txn_" + UUID.randomUUID().toString().replace("-", "");
        if (random.nextDouble() > failureThreshold) {
            log.info("{} payment successful: transactionId={}", displayName, transactionId);
            return new ProviderPaymentResult(transactionId, ProviderPaymentResult.SUCCESS, providerKey,
                Instant.now(), "Payment processed successfully via " + displayName);
        }

        log.warn("{} payment failed: transactionId={}", displayName, transactionId);
        return new ProviderPaymentResult(transactionId, ProviderPaymentResult.FAILED, providerKey,
            Instant.now(), FAILURE_MESSAGE);
    }
}
