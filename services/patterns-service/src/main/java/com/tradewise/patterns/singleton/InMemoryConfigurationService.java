package com.tradewise.patterns.singleton;

import com.tradewise.patterns.config.PatternsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One instance per application context. Settings are copied once at construction.
 */
@Slf4j
@Service
public class InMemoryConfigurationService implements ConfigurationService {

    private final String instanceId;
    private final Map<String, String> settings;
    private final AtomicInteger accessCount = new AtomicInteger();

    public InMemoryConfigurationService(PatternsProperties properties) {
        this.instanceId = "ConfigService-" + UUID.randomUUID().toString().replace("-", "");
        this.settings = Map.copyOf(properties.getSingleton().getSettings());
        log.info("Configuration service {} created with {} settings", instanceId, settings.size());
    }

    @Override
    public String getValue(String key) {
        accessCount.incrementAndGet();
        return settings.getOrDefault(key, "");
    }

    @Override
    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public int getAccessCount() {
        return accessCount.get();
    }
}
