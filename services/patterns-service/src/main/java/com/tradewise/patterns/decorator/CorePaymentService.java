package com.tradewise.patterns.decorator;

import com.tradewise.common.gateway.PaymentGateway;
import com.tradewise.common.gateway.PaymentRequest;
import com.tradewise.common.gateway.PaymentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class CorePaymentService implements PaymentService {

    private final PaymentGateway gateway;

    @Override
    public PaymentResult processPayment(PaymentRequest request) {
        log.info("Processing payment {} via {}", request.transactionId(), gateway.getProviderName());
        return gateway.processPayment(request);
    }
}
