package com.knowledge.store.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of probing the pool, the graph database or the search cluster.
 *
 * <p>{@link Status} constants are ordered from best to worst, which is what
 * {@link HealthCheckRegistry} relies on when folding several results.</p>
 */
public record HealthStatus(Status status, String summary, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    /** Round-trip time of the probe, in milliseconds. */
    public static final String LATENCY_MS = "latencyMs";

    /** Simple class name of the exception that failed the probe. */
    public static final String ERROR = "error";

    public HealthStatus {
        Objects.requireNonNull(status, "status");
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus ok() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus down(String summary) {
        return new HealthStatus(Status.DOWN, summary, Map.of());
    }

    public static HealthStatus degraded(String summary) {
        return new HealthStatus(Status.DEGRADED, summary, Map.of());
    }

    /**
     * DOWN result for a probe that threw, with the exception type under {@link #ERROR}.
     *
     * @param component human readable name of what was probed, e.g. "Graph database"
     */
    public static HealthStatus failure(String component, Exception cause) {
        return new HealthStatus(Status.DOWN, component + " check failed: " + cause.getMessage(),
                Map.of(ERROR, cause.getClass().getSimpleName()));
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, summary, merged);
    }

    /**
     * Adds {@link #LATENCY_MS} measured from {@code startMs} to now.
     */
    public HealthStatus withLatencySince(long startMs) {
        return withDetail(LATENCY_MS, System.currentTimeMillis() - startMs);
    }

    boolean isWorseThan(Status other) {
        return status.ordinal() > other.ordinal();
    }
}
