package fr.lapetina.tracker.client.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer instrumentation of tracker calls.
 *
 * Provides:
 * - Call counters per operation and outcome
 * - Call latency per operation
 */
public final class TrackerMetrics {

    public static final String DEFAULT_PREFIX = "tracker_client";

    private final MeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public TrackerMetrics(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
    }

    public TrackerMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Metrics kept in a private in-memory registry.
     */
    public static TrackerMetrics inMemory() {
        return new TrackerMetrics(new SimpleMeterRegistry());
    }

    /**
     * Counts one call.
     *
     * @param operation {@code request} or {@code done}
     * @param outcome   {@code success}, a tracker error name, or {@code transport_error}
     */
    public void incrementRequestCount(String operation, String outcome) {
        String key = operation + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of tracker calls")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordLatency(String operation, Duration latency) {
        latencyTimers.computeIfAbsent(operation, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Tracker call latency")
                        .tag("operation", operation)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
