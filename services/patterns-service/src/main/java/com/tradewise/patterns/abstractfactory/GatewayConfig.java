package com.tradewise.patterns.abstractfactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings belonging to one gateway family.
 */
public record GatewayConfig(String providerName, Map<String, String> settings) {

    public GatewayConfig {
        settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }
}
