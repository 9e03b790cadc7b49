package com.knowledge.store.graph;

import com.knowledge.store.metrics.MetricsService;
import com.knowledge.store.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size connection pool backed by a fair {@link ArrayBlockingQueue}.
 *
 * <p>All {@code size} connections are opened up front by {@link #init()}.
 * Acquire is a timed {@code poll} and release an {@code offer}, so no
 * external lock is involved; a connection taken from the queue belongs to
 * one lease until it is handed back. Each initialization gets its own queue
 * and every lease remembers the queue it came from: a connection returned
 * after {@link #close()} is closed instead of refilling the pool.</p>
 */
public class BoundedGraphConnectionPool implements GraphConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(BoundedGraphConnectionPool.class);

    private final PoolConfig config;
    private final GraphConnectionFactory connectionFactory;
    private final MetricsService metrics;
    private volatile BlockingQueue<GraphConnection> idleConnections;
    private final AtomicLong totalAcquired = new AtomicLong(0);
    private final AtomicLong totalReleased = new AtomicLong(0);
    private final AtomicLong totalCreated = new AtomicLong(0);
    private final AtomicLong acquireTimeouts = new AtomicLong(0);

    public BoundedGraphConnectionPool(PoolConfig config) {
        this(config, FalkorDBConnection::open, new NoOpMetricsService());
    }

    public BoundedGraphConnectionPool(PoolConfig config, GraphConnectionFactory connectionFactory) {
        this(config, connectionFactory, new NoOpMetricsService());
    }

    public BoundedGraphConnectionPool(PoolConfig config, GraphConnectionFactory connectionFactory,
                                      MetricsService metrics) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.metrics = metrics;
    }

    @Override
    public synchronized void init() {
        if (idleConnections != null) {
            return;
        }

        List<GraphConnection> created = new ArrayList<>(config.getSize());
        try {
            for (int i = 0; i < config.getSize(); i++) {
                created.add(connectionFactory.open(config));
                totalCreated.incrementAndGet();
            }
        } catch (RuntimeException e) {
            log.error("Failed to initialize connection pool after {}/{} connections",
                    created.size(), config.getSize(), e);
            for (GraphConnection conn : created) {
                closeQuietly(conn);
            }
            throw e;
        }

        BlockingQueue<GraphConnection> queue = new ArrayBlockingQueue<>(config.getSize(), true);
        queue.addAll(created);
        idleConnections = queue;
        log.info("Connection pool initialized with {} connections: {}", config.getSize(), config);
    }

    @Override
    public ConnectionLease acquire() {
        BlockingQueue<GraphConnection> queue = idleConnections;
        if (queue == null) {
            throw new PoolNotInitializedException();
        }

        Duration timeout = config.getAcquireTimeout();
        long startNanos = System.nanoTime();
        GraphConnection conn;
        try {
            conn = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquireTimeoutException(timeout, e);
        }

        if (conn == null) {
            acquireTimeouts.incrementAndGet();
            metrics.incrementAcquireTimeout();
            AcquireTimeoutException timeoutException = new AcquireTimeoutException(timeout);
            log.error("Timed out waiting for graph connection", timeoutException);
            throw timeoutException;
        }

        metrics.recordAcquireWait(Duration.ofNanos(System.nanoTime() - startNanos));
        totalAcquired.incrementAndGet();
        log.debug("Connection acquired (idle={})", queue.size());
        return new ConnectionLease(conn, released -> release(queue, released));
    }

    @Override
    public List<Map<String, Object>> executeSchema(String statement, Map<String, Object> params) {
        try (ConnectionLease lease = acquire()) {
            return lease.query(statement, params);
        }
    }

    @Override
    public List<List<Map<String, Object>>> executeSchema(List<String> statements) {
        try (ConnectionLease lease = acquire()) {
            List<List<Map<String, Object>>> results = new ArrayList<>(statements.size());
            for (String statement : statements) {
                results.add(lease.query(statement));
            }
            return results;
        }
    }

    @Override
    public boolean isInitialized() {
        return idleConnections != null;
    }

    @Override
    public PoolConfig getConfig() {
        return config;
    }

    @Override
    public PoolStats getStats() {
        BlockingQueue<GraphConnection> queue = idleConnections;
        long acquired = totalAcquired.get();
        long released = totalReleased.get();
        return new PoolStats(
                config.getSize(),
                queue != null ? queue.size() : 0,
                (int) (acquired - released),
                acquired,
                released,
                totalCreated.get(),
                acquireTimeouts.get()
        );
    }

    @Override
    public synchronized void close() {
        BlockingQueue<GraphConnection> queue = idleConnections;
        if (queue == null) {
            return;
        }
        log.info("Closing connection pool...");
        idleConnections = null;
        int closed = drain(queue);
        log.info("Connection pool closed ({} idle connections closed)", closed);
    }

    private void release(BlockingQueue<GraphConnection> queue, GraphConnection connection) {
        totalReleased.incrementAndGet();

        if (idleConnections != queue || !queue.offer(connection)) {
            log.debug("Connection returned to a closed pool, closing it");
            closeQuietly(connection);
            return;
        }

        // close() may have drained the queue between the check and the offer
        if (idleConnections != queue) {
            drain(queue);
        }
        log.debug("Connection released (idle={})", queue.size());
    }

    private int drain(BlockingQueue<GraphConnection> queue) {
        int count = 0;
        GraphConnection conn;
        while ((conn = queue.poll()) != null) {
            closeQuietly(conn);
            count++;
        }
        return count;
    }

    private void closeQuietly(GraphConnection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Failed to close graph connection: {}", e.getMessage());
        }
    }
}
