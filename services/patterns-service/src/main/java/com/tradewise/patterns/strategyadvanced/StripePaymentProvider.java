package com.tradewise.patterns.strategyadvanced;

import com.tradewise.patterns.config.PatternsProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Card payments in USD, EUR and GBP from 1.00; about 95% succeed.
 */
@Component
public class StripePaymentProvider extends SimulatedPaymentProvider {

    public static final String KEY = "stripe";

    public StripePaymentProvider(PatternsProperties properties) {
        super(KEY, "Stripe", new BigDecimal("1.00"), List.of("USD", "EUR", "GBP"), 0.05,
            properties.getProviders().getStripe());
    }
}
