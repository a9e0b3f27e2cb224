package com.tradewise.common.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * {@link MetricsSink} backed by the application's Micrometer registry.
 * Only meters registered through this sink appear in {@link #snapshot()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry meterRegistry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<Double>> gauges = new ConcurrentHashMap<>();

    @Override
    public void incrementCounter(String name, Map<String, String> tags) {
        counters.computeIfAbsent(key(name, tags), k -> Counter.builder(name)
                        .tags(toTags(tags))
                        .register(meterRegistry))
                .increment();
    }

    @Override
    public void recordDuration(String name, Duration duration, Map<String, String> tags) {
        timers.computeIfAbsent(key(name, tags), k -> Timer.builder(name)
                        .tags(toTags(tags))
                        .register(meterRegistry))
                .record(duration);
    }

    @Override
    public void setGauge(String name, double value, Map<String, String> tags) {
        gauges.computeIfAbsent(key(name, tags), k -> {
            AtomicReference<Double> holder = new AtomicReference<>(0.0);
            Gauge.builder(name, holder, AtomicReference::get)
                    .tags(toTags(tags))
                    .register(meterRegistry);
            return holder;
        }).set(value);
    }

    @Override
    public MetricsSnapshot snapshot() {
        Map<String, Double> counterValues = new TreeMap<>();
        counters.forEach((key, counter) -> counterValues.put(key, counter.count()));

        Map<String, MetricsSnapshot.DurationStats> durationValues = new TreeMap<>();
        timers.forEach((key, timer) -> durationValues.put(key, new MetricsSnapshot.DurationStats(
                timer.count(),
                timer.totalTime(TimeUnit.MILLISECONDS),
                timer.max(TimeUnit.MILLISECONDS))));

        Map<String, Double> gaugeValues = new TreeMap<>();
        gauges.forEach((key, holder) -> gaugeValues.put(key, holder.get()));

        log.debug("Metrics snapshot: {} counters, {} durations, {} gauges",
                counterValues.size(), durationValues.size(), gaugeValues.size());
        return new MetricsSnapshot(counterValues, durationValues, gaugeValues);
    }

    private static Tags toTags(Map<String, String> tags) {
        Tags result = Tags.empty();
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            result = result.and(tag.getKey(), tag.getValue());
        }
        return result;
    }

    private static String key(String name, Map<String, String> tags) {
        if (tags.isEmpty()) {
            return name;
        }
        return name + new TreeMap<>(tags).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }
}
