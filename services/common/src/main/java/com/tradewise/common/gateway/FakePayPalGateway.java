package com.tradewise.common.gateway;

import java.time.Duration;
import java.util.Random;

/**
 * PayPal stand-in: approves about 90% of payments.
 */
public class FakePayPalGateway extends SimulatedPaymentGateway {

    public FakePayPalGateway(Random random, Duration latency) {
        super(random, latency, 0.10, "Payment declined");
    }

    @Override
    public String getProviderName() {
        return "PayPal";
    }
}
