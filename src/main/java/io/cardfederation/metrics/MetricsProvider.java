package io.cardfederation.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/*
 * MetricsProvider creates and caches the counters, gauges and timers of the federation service.
 * Every meter carries the instance tag.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};

    private final MeterRegistry registry;
    private final String instance;
    private final ConcurrentMap<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String instance) {
        this.registry = registry;
        this.instance = instance;
        log.info("MetricsProvider initialized for instance: {}", instance);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     *
     * @return the AtomicDouble holding the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String key = name + new TreeMap<>(tags);
        return gauges.computeIfAbsent(key, ignored -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
            return value;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    // ===== FEDERATION METERS =====

    public void recordSyncOperation(String operation, String platform, String outcome) {
        counter(MetricsConstants.SYNC_OPERATIONS_METRIC_NAME, Map.of(
                MetricsConstants.OPERATION_TAG, operation,
                MetricsConstants.PLATFORM_TAG, platform,
                MetricsConstants.OUTCOME_TAG, outcome)).increment();
    }

    public void recordPoll(String platform, String outcome) {
        counter(MetricsConstants.POLL_METRIC_NAME, Map.of(
                MetricsConstants.PLATFORM_TAG, platform,
                MetricsConstants.OUTCOME_TAG, outcome)).increment();
    }

    public void recordConnectionCheck(String platform, boolean connected) {
        counter(MetricsConstants.CONNECTION_CHECKS_METRIC_NAME, Map.of(
                MetricsConstants.PLATFORM_TAG, platform,
                MetricsConstants.OUTCOME_TAG, connected ? MetricsConstants.OUTCOME_CONNECTED
                        : MetricsConstants.OUTCOME_UNREACHABLE)).increment();
    }

    public void setTrackedSyncStates(int count) {
        gauge(MetricsConstants.TRACKED_SYNC_STATES_METRIC_NAME, Map.of()).set(count);
    }

    public Timer pollTimer(String platform) {
        return timer(MetricsConstants.POLL_DURATION_METRIC_NAME, Map.of(MetricsConstants.PLATFORM_TAG, platform));
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including the instance tag.
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = MetricsConstants.INSTANCE_TAG;
        tagArray[index] = instance;
        return tagArray;
    }
}
