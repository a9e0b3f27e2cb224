package com.tradewise.patterns.decorator;

import com.tradewise.common.gateway.PaymentRequest;
import com.tradewise.common.gateway.PaymentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class LoggingPaymentServiceDecorator implements PaymentService {

    private final PaymentService inner;

    @Override
    public PaymentResult processPayment(PaymentRequest request) {
        log.info("Payment request started: {}, Amount: {} {}",
            request.transactionId(), request.amount(), request.currency());
        PaymentResult result = inner.processPayment(request);
        log.info("Payment request completed: {}, Success: {}", request.transactionId(), result.success());
        return result;
    }
}
