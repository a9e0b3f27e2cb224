package com.tradewise.patterns.decorator;

import com.tradewise.common.gateway.PaymentRequest;
import com.tradewise.common.gateway.PaymentResult;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * Retries declined results and exceptions with the supplied policy.
 * When the budget runs out on a declined result it is returned as is;
 * when it runs out on an exception the exception becomes a failed result.
 */
@Slf4j
public class RetryPaymentServiceDecorator implements PaymentService {

    private final PaymentService inner;
    private final Retry retry;

    public RetryPaymentServiceDecorator(PaymentService inner, Retry retry) {
        this.inner = inner;
        this.retry = retry;
        this.retry.getEventPublisher()
            .onRetry(event -> log.warn("Payment attempt {} failed, retrying in {}ms",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
    }

    @Override
    public PaymentResult processPayment(PaymentRequest request) {
        try {
            return retry.executeSupplier(() -> inner.processPayment(request));
        } catch (RuntimeException e) {
            log.error("Payment failed after {} attempts: {}",
                retry.getRetryConfig().getMaxAttempts(), request.transactionId(), e);
            return PaymentResult.declined(request.transactionId(), e.getMessage());
        }
    }
}
