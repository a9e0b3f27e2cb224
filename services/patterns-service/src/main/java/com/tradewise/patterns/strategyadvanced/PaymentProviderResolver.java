package com.tradewise.patterns.strategyadvanced;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Case-insensitive lookup of payment providers by key.
 * <p>
 * The table is built once from every {@link PaymentProvider} bean and never modified, so lookups need no
 * locking. Two providers with the same key fail context startup.
 */
@Slf4j
@Component
public class PaymentProviderResolver {

    private final Map<String, PaymentProvider> providers;

    public PaymentProviderResolver(List<PaymentProvider> paymentProviders) {
        Map<String, PaymentProvider> registry = new TreeMap<>();
        for (PaymentProvider provider : paymentProviders) {
            String key = normalize(provider.getProviderKey());
            PaymentProvider existing = registry.putIfAbsent(key, provider);
            if (existing != null) {
                throw new IllegalStateException(String.format("Duplicate payment provider key '%s': %s and %s",
                    key, existing.getClass().getSimpleName(), provider.getClass().getSimpleName()));
            }
        }
        this.providers = Collections.unmodifiableMap(registry);

        log.info("Payment provider resolver initialized with {} providers: {}",
            providers.size(), String.join(", ", providers.keySet()));
    }

    public Optional<PaymentProvider> resolve(String providerKey) {
        if (providerKey == null || providerKey.isBlank()) {
            log.warn("Attempted to resolve provider with null or empty key");
            return Optional.empty();
        }

        PaymentProvider provider = providers.get(normalize(providerKey));
        if (provider == null) {
            log.warn("Payment provider '{}' not found. Available providers: {}",
                providerKey, String.join(", ", providers.keySet()));
        }
        return Optional.ofNullable(provider);
    }

    /**
     * Registered providers ordered by key.
     */
    public List<PaymentProvider> listAvailable() {
        return List.copyOf(providers.values());
    }

    public List<String> availableKeys() {
        return List.copyOf(providers.keySet());
    }

    private static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
