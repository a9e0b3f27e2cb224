package com.tradewise.patterns.strategyadvanced;

import java.math.BigDecimal;
import java.util.List;

public record ProviderInfo(String key, BigDecimal minimumAmount, List<String> supportedCurrencies) {

    static ProviderInfo from(PaymentProvider provider) {
        return new ProviderInfo(provider.getProviderKey(), provider.getMinimumAmount(), provider.getSupportedCurrencies());
    }
}
