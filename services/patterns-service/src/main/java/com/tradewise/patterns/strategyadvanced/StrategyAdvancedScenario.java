package com.tradewise.patterns.strategyadvanced;

import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.exception.PaymentProviderNotFoundException;
import com.tradewise.patterns.exception.PaymentValidationException;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class StrategyAdvancedScenario implements PatternScenario {

    private static final String CUSTOMER_EMAIL = "customer@example.com";

    private final PaymentProviderResolver resolver;
    private final ProviderPaymentService paymentService;

    @Override
    public String slug() {
        return "strategy-advanced";
    }

    @Override
    public String patternName() {
        return "Strategy (Advanced)";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();
        results.add(process(new ProcessPaymentRequest(new BigDecimal("100.00"), "USD", "stripe", CUSTOMER_EMAIL)));
        results.add(process(new ProcessPaymentRequest(new BigDecimal("25.00"), "CAD", "PayPal", CUSTOMER_EMAIL)));
        results.add(process(new ProcessPaymentRequest(new BigDecimal("50.00"), "BTC", "CRYPTO", CUSTOMER_EMAIL)));

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates strategy pattern with a resolver: payment providers are registered once and selected by key at runtime.")
            .result(results)
            .metadata(Map.of(
                "Providers", paymentService.getAvailableProviders(),
                "CaseInsensitiveKeys", true))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        boolean sameProvider = resolver.resolve("STRIPE").isPresent()
            && resolver.resolve("STRIPE").get() == resolver.resolve("stripe").orElse(null);
        checks.add(new TestCheck("Case-Insensitive Resolution", sameProvider,
            "STRIPE and stripe resolve to the same provider"));

        checks.add(new TestCheck("Unknown Provider", resolver.resolve("unknown").isEmpty(),
            "Unknown key resolves to no provider"));

        boolean rejected = false;
        try {
            paymentService.processPayment(new ProcessPaymentRequest(new BigDecimal("5.00"), "USD", "crypto", CUSTOMER_EMAIL));
        } catch (PaymentValidationException e) {
            rejected = true;
        }
        checks.add(new TestCheck("Provider Validation", rejected,
            "Crypto rejected an amount below its minimum: " + rejected));

        ProviderPaymentResult result = paymentService.processPayment(
            new ProcessPaymentRequest(new BigDecimal("10.00"), "EUR", "paypal", CUSTOMER_EMAIL));
        checks.add(new TestCheck("Payment Processing",
            result.transactionId().startsWith(PayPalPaymentProvider.KEY + "_txn_"),
            "Processed " + result.transactionId() + " with status " + result.status()));

        return PatternTestResponse.of(patternName(), checks);
    }

    private Object process(ProcessPaymentRequest request) {
        try {
            return paymentService.processPayment(request);
        } catch (PaymentProviderNotFoundException | PaymentValidationException e) {
            return Map.of("providerKey", request.providerKey(), "error", e.getMessage());
        }
    }
}
