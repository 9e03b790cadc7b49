package com.knowledge.store.graph;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Exclusive, scoped borrow of one {@link GraphConnection}.
 * Closing the lease hands the connection back exactly once; further
 * calls to {@link #close()} are ignored.
 *
 * <pre>
 * try (ConnectionLease lease = pool.acquire()) {
 *     lease.query("MATCH (f:Fact) RETURN count(f) AS facts");
 * }
 * </pre>
 */
public class ConnectionLease implements AutoCloseable {

    private final GraphConnection connection;
    private final Consumer<GraphConnection> releaser;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConnectionLease(GraphConnection connection, Consumer<GraphConnection> releaser) {
        this.connection = connection;
        this.releaser = releaser;
    }

    /**
     * Returns the leased connection. Must not be used after the lease is closed.
     */
    public GraphConnection connection() {
        if (released.get()) {
            throw new IllegalStateException("Lease already released");
        }
        return connection;
    }

    public List<Map<String, Object>> query(String statement, Map<String, Object> params) {
        return connection().query(statement, params);
    }

    public List<Map<String, Object>> query(String statement) {
        return connection().query(statement);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.accept(connection);
        }
    }
}
