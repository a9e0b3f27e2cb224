package com.tradewise.patterns.singleton;

/**
 * Process-wide read-only configuration with an access counter.
 */
public interface ConfigurationService {

    /**
     * @return the configured value, or an empty string when the key is unknown
     */
    String getValue(String key);

    String getInstanceId();

    int getAccessCount();
}
