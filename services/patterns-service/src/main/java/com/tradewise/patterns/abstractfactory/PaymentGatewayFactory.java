package com.tradewise.patterns.abstractfactory;

import com.tradewise.common.gateway.PaymentGateway;

/**
 * Creates a gateway together with the configuration that belongs to it.
 */
public interface PaymentGatewayFactory {

    PaymentGateway createPaymentGateway();

    GatewayConfig createConfiguration();

    String getFactoryType();
}
