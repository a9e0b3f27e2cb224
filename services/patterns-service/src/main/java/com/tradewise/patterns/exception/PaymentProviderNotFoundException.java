package com.tradewise.patterns.exception;

import com.tradewise.common.error.ErrorCode;
import com.tradewise.common.error.ResourceNotFoundException;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when a payment names a provider key that is not registered.
 * The message lists every key that is.
 */
@Getter
public class PaymentProviderNotFoundException extends ResourceNotFoundException {

    private final String providerKey;
    private final List<String> availableProviders;

    public PaymentProviderNotFoundException(String providerKey, List<String> availableProviders) {
        super(ErrorCode.PAYMENT_PROVIDER_NOT_FOUND, "PaymentProvider", providerKey,
            String.format("Payment provider '%s' not found. Available providers: %s",
                providerKey, String.join(", ", availableProviders)));
        this.providerKey = providerKey;
        this.availableProviders = List.copyOf(availableProviders);
    }
}
