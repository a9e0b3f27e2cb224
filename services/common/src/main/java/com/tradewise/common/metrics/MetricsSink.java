package com.tradewise.common.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Counter, duration and gauge recording with tag maps.
 */
public interface MetricsSink {

    void incrementCounter(String name, Map<String, String> tags);

    void recordDuration(String name, Duration duration, Map<String, String> tags);

    void setGauge(String name, double value, Map<String, String> tags);

    /**
     * Values of every meter recorded through this sink.
     */
    MetricsSnapshot snapshot();
}
