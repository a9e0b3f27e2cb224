package com.tradewise.common.gateway;

import java.time.Duration;
import java.util.Random;

/**
 * Stripe stand-in: approves about 95% of payments.
 */
public class FakeStripeGateway extends SimulatedPaymentGateway {

    public FakeStripeGateway(Random random, Duration latency) {
        super(random, latency, 0.05, "Insufficient funds");
    }

    @Override
    public String getProviderName() {
        return "Stripe";
    }
}
