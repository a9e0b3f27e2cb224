package com.tradewise.common.gateway;

import com.tradewise.common.error.PaymentProcessingException;

import java.time.Duration;

/**
 * Blocks the caller to imitate a network round trip.
 */
public final class SimulatedLatency {

    private SimulatedLatency() {
    }

    /**
     * @throws PaymentProcessingException if the thread is interrupted while waiting; the interrupt flag is restored
     */
    public static void pause(Duration latency) {
        if (latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PaymentProcessingException("Interrupted while waiting for provider response", e);
        }
    }
}
