package com.tradewise.patterns.strategyadvanced;

import com.tradewise.patterns.config.PatternsProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Wallet payments in USD, EUR and CAD from 0.50; about 90% succeed.
 */
@Component
public class PayPalPaymentProvider extends SimulatedPaymentProvider {

    public static final String KEY = "paypal";

    public PayPalPaymentProvider(PatternsProperties properties) {
        super(KEY, "PayPal", new BigDecimal("0.50"), List.of("USD", "EUR", "CAD"), 0.10,
            properties.getProviders().getPaypal());
    }
}
