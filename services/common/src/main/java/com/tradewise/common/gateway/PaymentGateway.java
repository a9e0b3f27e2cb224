package com.tradewise.common.gateway;

public interface PaymentGateway {

    String getProviderName();

    PaymentResult processPayment(PaymentRequest request);
}
