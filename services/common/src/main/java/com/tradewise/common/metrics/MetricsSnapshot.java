package com.tradewise.common.metrics;

import java.util.Map;

/**
 * Point-in-time view of recorded meters. Keys have the form {@code name{tag=value,...}}.
 */
public record MetricsSnapshot(
        Map<String, Double> counters,
        Map<String, DurationStats> durations,
        Map<String, Double> gauges) {

    public record DurationStats(long count, double totalMillis, double maxMillis) {
    }
}
