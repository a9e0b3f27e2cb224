package com.tradewise.patterns.strategyadvanced;

import com.tradewise.patterns.exception.PaymentProviderNotFoundException;
import com.tradewise.patterns.exception.PaymentValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Routes a payment to the provider named in the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderPaymentService {

    private final PaymentProviderResolver resolver;

    /**
     * @throws PaymentProviderNotFoundException when no provider is registered under the key
     * @throws PaymentValidationException when the provider rejects the amount or currency
     */
    public ProviderPaymentResult processPayment(ProcessPaymentRequest request) {
        log.info("Processing payment request: provider={}, amount={}, currency={}",
            request.providerKey(), request.amount(), request.currency());

        PaymentProvider provider = resolver.resolve(request.providerKey())
            .orElseThrow(() -> new PaymentProviderNotFoundException(request.providerKey(), resolver.availableKeys()));

        if (!provider.validatePayment(request.amount(), request.currency())) {
            log.warn("Payment validation failed for provider '{}'", request.providerKey());
            throw new PaymentValidationException(request.providerKey());
        }

        ProviderPaymentResult result = provider.processPayment(request.amount(), request.currency(), request.customerEmail());
        log.info("Payment processed: transactionId={}, status={}", result.transactionId(), result.status());
        return result;
    }

    public List<ProviderInfo> getAvailableProviders() {
        return resolver.listAvailable().stream()
            .map(ProviderInfo::from)
            .toList();
    }
}
