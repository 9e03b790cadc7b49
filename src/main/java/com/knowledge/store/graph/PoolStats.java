package com.knowledge.store.graph;

/**
 * Statistics for a {@link GraphConnectionPool}.
 *
 * @param size               fixed number of connections the pool manages
 * @param idleConnections    connections available for acquiring
 * @param checkedOut         connections currently leased
 * @param totalAcquired      cumulative lease count since pool creation
 * @param totalReleased      cumulative release count since pool creation
 * @param totalCreated       cumulative connection creation count
 * @param acquireTimeouts    cumulative number of acquire calls that timed out
 */
public record PoolStats(
        int size,
        int idleConnections,
        int checkedOut,
        long totalAcquired,
        long totalReleased,
        long totalCreated,
        long acquireTimeouts
) {
}
