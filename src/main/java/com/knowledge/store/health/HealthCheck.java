package com.knowledge.store.health;

/**
 * A single component probe (connection pool, graph database, search cluster).
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the probe. Implementations report failures as a DOWN status
     * rather than throwing.
     */
    HealthStatus check();
}
