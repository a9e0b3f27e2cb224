package com.tradewise.patterns.abstractfactory;

import com.tradewise.common.gateway.FakePayPalGateway;
import com.tradewise.common.gateway.PaymentGateway;
import com.tradewise.patterns.config.PatternsProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

@Component
public class PayPalGatewayFactory implements PaymentGatewayFactory {

    private final PatternsProperties.Simulation simulation;

    public PayPalGatewayFactory(PatternsProperties properties) {
        this.simulation = properties.getGateways().getPaypal();
    }

    @Override
    public String getFactoryType() {
        return "PayPal";
    }

    @Override
    public PaymentGateway createPaymentGateway() {
        return new FakePayPalGateway(new Random(simulation.getSeed()), simulation.getLatency());
    }

    @Override
    public GatewayConfig createConfiguration() {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put("ClientId", "paypal_client_...");
        settings.put("ClientSecret", "paypal_secret_...");
        settings.put("Mode", "sandbox");
        settings.put("Timeout", "45s");
        settings.put("RetryPolicy", "linear");
        return new GatewayConfig("PayPal", settings);
    }
}
