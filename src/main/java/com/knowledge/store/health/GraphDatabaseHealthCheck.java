package com.knowledge.store.health;

import com.knowledge.store.graph.ConnectionLease;
import com.knowledge.store.graph.GraphConnectionPool;

/**
 * Leases a pooled connection, runs {@code RETURN 1} and reports the latency.
 */
public class GraphDatabaseHealthCheck implements HealthCheck {

    private final GraphConnectionPool pool;

    public GraphDatabaseHealthCheck(GraphConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "graphDatabase";
    }

    @Override
    public HealthStatus check() {
        try (ConnectionLease lease = pool.acquire()) {
            long startMs = System.currentTimeMillis();
            lease.query("RETURN 1");

            return HealthStatus.ok()
                    .withLatencySince(startMs)
                    .withDetail("graphName", lease.connection().getGraphName());
        } catch (Exception e) {
            return HealthStatus.failure("Graph database", e);
        }
    }
}
