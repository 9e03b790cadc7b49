package com.knowledge.store.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code knowledge.pool.acquire.wait} - Timer</li>
 *   <li>{@code knowledge.pool.acquire.timeout} - Counter</li>
 *   <li>{@code knowledge.schema.migration} - Counter (tag: version)</li>
 *   <li>{@code knowledge.search.request} - Timer (tags: operation, outcome)</li>
 *   <li>{@code knowledge.search.index.provisioned} - Counter (tags: index, created)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer acquireWaitTimer;
    private final Counter acquireTimeoutCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.acquireWaitTimer = Timer.builder("knowledge.pool.acquire.wait")
                .description("Time spent waiting for an idle graph connection")
                .register(registry);
        this.acquireTimeoutCounter = Counter.builder("knowledge.pool.acquire.timeout")
                .description("Number of acquire calls that timed out")
                .register(registry);
    }

    @Override
    public void recordAcquireWait(Duration duration) {
        acquireWaitTimer.record(duration);
    }

    @Override
    public void incrementAcquireTimeout() {
        acquireTimeoutCounter.increment();
    }

    @Override
    public void incrementMigrationApplied(String version) {
        String key = "migration:" + version;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("knowledge.schema.migration")
                        .description("Number of schema migration steps applied")
                        .tag("version", version)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSearchRequest(String operation, Duration duration, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = operation + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("knowledge.search.request")
                        .description("Duration of search engine calls")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementIndexProvisioned(String index, boolean created) {
        String key = "index:" + index + ":" + created;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("knowledge.search.index.provisioned")
                        .description("Index provisioning outcomes")
                        .tag("index", index)
                        .tag("created", String.valueOf(created))
                        .register(registry));
        counter.increment();
    }
}
