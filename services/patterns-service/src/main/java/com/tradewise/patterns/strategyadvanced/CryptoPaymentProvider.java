package com.tradewise.patterns.strategyadvanced;

import com.tradewise.patterns.config.PatternsProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

@Component
public class CryptoPaymentProvider extends SimulatedPaymentProvider {

    public static final String KEY = "crypto";

    public CryptoPaymentProvider(PatternsProperties properties) {
        super(KEY, "Cryptocurrency", new BigDecimal("10.00"), List.of("BTC", "ETH", "USDT"), 0.15,
            properties.getProviders().getCrypto());
    }
}
