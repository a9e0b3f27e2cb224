package com.tradewise.patterns.decorator;

import com.tradewise.common.gateway.PaymentRequest;
import com.tradewise.common.gateway.PaymentResult;

/**
 * Payment processing contract shared by the core service and every decorator wrapping it.
 */
public interface PaymentService {

    PaymentResult processPayment(PaymentRequest request);
}
