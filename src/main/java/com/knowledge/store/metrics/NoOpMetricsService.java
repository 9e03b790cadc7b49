package com.knowledge.store.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAcquireWait(Duration duration) {
    }

    @Override
    public void incrementAcquireTimeout() {
    }

    @Override
    public void incrementMigrationApplied(String version) {
    }

    @Override
    public void recordSearchRequest(String operation, Duration duration, boolean success) {
    }

    @Override
    public void incrementIndexProvisioned(String index, boolean created) {
    }
}
