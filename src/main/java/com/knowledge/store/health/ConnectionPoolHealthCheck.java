package com.knowledge.store.health;

import com.knowledge.store.graph.GraphConnectionPool;
import com.knowledge.store.graph.PoolStats;

/**
 * Reports pool utilization. DOWN when the pool is not initialized or every
 * connection is leased, DEGRADED from 80% utilization.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.80;

    private final GraphConnectionPool pool;

    public ConnectionPoolHealthCheck(GraphConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        if (!pool.isInitialized()) {
            return HealthStatus.down("Connection pool not initialized");
        }
        try {
            PoolStats stats = pool.getStats();
            int size = stats.size();
            int checkedOut = stats.checkedOut();
            double usage = size > 0 ? (double) checkedOut / size : 0.0;

            HealthStatus base;
            if (checkedOut >= size) {
                base = HealthStatus.down("Connection pool exhausted: all connections leased");
            } else if (usage >= DEGRADED_THRESHOLD) {
                base = HealthStatus.degraded("Connection pool usage high: " + String.format("%.0f%%", usage * 100));
            } else {
                base = HealthStatus.ok();
            }

            return base
                    .withDetail("size", size)
                    .withDetail("checkedOut", checkedOut)
                    .withDetail("idleConnections", stats.idleConnections())
                    .withDetail("totalAcquired", stats.totalAcquired())
                    .withDetail("acquireTimeouts", stats.acquireTimeouts());
        } catch (Exception e) {
            return HealthStatus.failure("Connection pool", e);
        }
    }
}
