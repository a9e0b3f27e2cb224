package com.tradewise.patterns.strategyadvanced;

import java.math.BigDecimal;
import java.util.List;

/**
 * A payment processing strategy registered under a unique key.
 * Implementations are stateless apart from their simulation and safe to share.
 */
public interface PaymentProvider {

    /**
     * Lookup key, unique across providers and compared case-insensitively.
     */
    String getProviderKey();

    BigDecimal getMinimumAmount();

    List<String> getSupportedCurrencies();

    /**
     * @return false when the amount is below the minimum or the currency is not supported
     */
    boolean validatePayment(BigDecimal amount, String currency);

    ProviderPaymentResult processPayment(BigDecimal amount, String currency, String customerEmail);
}
