package com.tradewise.patterns.abstractfactory;

import com.tradewise.common.gateway.PaymentGateway;
import com.tradewise.common.gateway.PaymentRequest;
import com.tradewise.common.gateway.PaymentResult;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class AbstractFactoryScenario implements PatternScenario {

    private final StripeGatewayFactory stripeFactory;
    private final PayPalGatewayFactory payPalFactory;

    @Override
    public String slug() {
        return "abstract-factory";
    }

    @Override
    public String patternName() {
        return "Abstract Factory";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();

        PaymentGateway stripeGateway = stripeFactory.createPaymentGateway();
        results.add(new GatewayFamily(stripeFactory.getFactoryType(), stripeGateway.getProviderName(),
            stripeFactory.createConfiguration()));

        PaymentGateway payPalGateway = payPalFactory.createPaymentGateway();
        results.add(new GatewayFamily(payPalFactory.getFactoryType(), payPalGateway.getProviderName(),
            payPalFactory.createConfiguration()));

        PaymentRequest payment = new PaymentRequest("TXN-STRIPE-001", new BigDecimal("100.50"), "USD", "ACC-001", null);
        PaymentResult stripeResult = stripeGateway.processPayment(payment);
        log.info("Stripe family processed {}: success={}", payment.transactionId(), stripeResult.success());
        results.add(new FamilyPayment("Stripe Payment", stripeResult));

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates abstract factory pattern: creates families of related objects (gateway + config).")
            .result(results)
            .metadata(Map.of(
                "FactoryCount", 2,
                "Extensibility", "Easy to add new gateway families without modifying existing code"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        PaymentGateway stripeGateway = stripeFactory.createPaymentGateway();
        checks.add(new TestCheck("Stripe Factory Creates Stripe Gateway",
            "Stripe".equals(stripeGateway.getProviderName()),
            "Created " + stripeGateway.getProviderName() + " gateway"));

        PaymentGateway payPalGateway = payPalFactory.createPaymentGateway();
        checks.add(new TestCheck("PayPal Factory Creates PayPal Gateway",
            "PayPal".equals(payPalGateway.getProviderName()),
            "Created " + payPalGateway.getProviderName() + " gateway"));

        GatewayConfig stripeConfig = stripeFactory.createConfiguration();
        checks.add(new TestCheck("Stripe Config Matches Gateway",
            stripeConfig.providerName().equals(stripeGateway.getProviderName()),
            String.format("Config provider %s matches gateway %s",
                stripeConfig.providerName(), stripeGateway.getProviderName())));

        return PatternTestResponse.of(patternName(), checks);
    }

    public record GatewayFamily(String factory, String gateway, GatewayConfig config) {
    }

    public record FamilyPayment(String payment, PaymentResult result) {
    }
}
