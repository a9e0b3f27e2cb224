package com.tradewise.common.gateway;

import com.tradewise.common.domain.Money;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;

/**
 * Base for fake gateways: waits for a fixed latency, then approves when the
 * next draw from the injected generator exceeds the failure threshold.
 */
@Slf4j
public abstract class SimulatedPaymentGateway implements PaymentGateway {

    private final Random random;
    private final Duration latency;
    private final double failureThreshold;
    private final String declineMessage;

    protected SimulatedPaymentGateway(Random random, Duration latency, double failureThreshold, String declineMessage) {
        this.random = random;
        this.latency = latency;
        this.failureThreshold = failureThreshold;
        this.declineMessage = declineMessage;
    }

    @Override
    public PaymentResult processPayment(PaymentRequest request) {
        log.debug("{} processing transaction {} for {}",
                getProviderName(), request.transactionId(), Money.of(request.amount(), request.currency()));

        SimulatedLatency.pause(latency);

        if (random.nextDouble() > failureThreshold) {
            return PaymentResult.approved(request.transactionId());
        }
        log.info("{} declined transaction {}: {}", getProviderName(), request.transactionId(), declineMessage);
        return PaymentResult.declined(request.transactionId(), declineMessage);
    }
}
