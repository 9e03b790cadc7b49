package com.knowledge.store.metrics;

import java.time.Duration;

/**
 * Interface for recording connection-layer metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pool and the
 * search client work without a meter registry.
 */
public interface MetricsService {

    void recordAcquireWait(Duration duration);

    void incrementAcquireTimeout();

    void incrementMigrationApplied(String version);

    void recordSearchRequest(String operation, Duration duration, boolean success);

    void incrementIndexProvisioned(String index, boolean created);
}
