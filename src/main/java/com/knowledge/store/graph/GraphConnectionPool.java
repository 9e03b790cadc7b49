package com.knowledge.store.graph;

import java.util.List;
import java.util.Map;

/**
 * Fixed-size pool of authenticated {@link GraphConnection}s.
 * Provides scoped leases for request handlers and the schema primitive
 * that migrations run through.
 */
public interface GraphConnectionPool extends AutoCloseable {

    /**
     * Opens every connection of the pool. A no-op when already initialized.
     * On failure every connection opened by this call is closed and the
     * failure is rethrown; the pool stays uninitialized.
     */
    void init();

    /**
     * Leases a connection. Blocks until a connection is returned by another
     * caller or the configured acquire timeout expires.
     * Use with try-with-resources so the connection is always returned.
     *
     * @return a lease on one connection
     * @throws PoolNotInitializedException if the pool is not initialized
     * @throws AcquireTimeoutException     if no connection became available in time
     */
    ConnectionLease acquire();

    /**
     * Leases a connection, runs one statement and returns its rows.
     */
    List<Map<String, Object>> executeSchema(String statement, Map<String, Object> params);

    default List<Map<String, Object>> executeSchema(String statement) {
        return executeSchema(statement, Map.of());
    }

    /**
     * Runs a multi-statement payload on a single lease, in order.
     *
     * @return the rows of each statement, in statement order
     */
    List<List<Map<String, Object>>> executeSchema(List<String> statements);

    boolean isInitialized();

    /**
     * Returns the pool configuration.
     */
    PoolConfig getConfig();

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    /**
     * Closes all idle connections and marks the pool uninitialized.
     * Leased connections are closed when their lease is closed.
     */
    @Override
    void close();
}
