package com.tradewise.patterns.abstractfactory;

import com.tradewise.common.gateway.FakeStripeGateway;
import com.tradewise.common.gateway.PaymentGateway;
import com.tradewise.patterns.config.PatternsProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

@Component
public class StripeGatewayFactory implements PaymentGatewayFactory {

    private final PatternsProperties.Simulation simulation;

    public StripeGatewayFactory(PatternsProperties properties) {
        this.simulation = properties.getGateways().getStripe();
    }

    @Override
    public String getFactoryType() {
        return "Stripe";
    }

    @Override
    public PaymentGateway createPaymentGateway() {
        return new FakeStripeGateway(new Random(simulation.getSeed()), simulation.getLatency());
    }

    @Override
    public GatewayConfig createConfiguration() {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put("ApiKey", "sk_test_...");
        settings.put("WebhookSecret", "whsec_...");
        settings.put("Timeout", "30s");
        settings.put("RetryPolicy", "exponential-backoff");
        return new GatewayConfig("Stripe", settings);
    }
}
