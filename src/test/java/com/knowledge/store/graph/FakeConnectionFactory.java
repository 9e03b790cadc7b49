package com.knowledge.store.graph;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * {@link GraphConnectionFactory} handing out {@link FakeGraphConnection}s.
 * Can be told to fail on the k-th open.
 */
public class FakeConnectionFactory implements GraphConnectionFactory {

    private final List<FakeGraphConnection> opened = new CopyOnWriteArrayList<>();
    private final BiFunction<String, Map<String, Object>, List<Map<String, Object>>> handler;
    private int failOnOpen = -1;
    private int attempts;

    public FakeConnectionFactory() {
        this((statement, params) -> List.of());
    }

    public FakeConnectionFactory(BiFunction<String, Map<String, Object>, List<Map<String, Object>>> handler) {
        this.handler = handler;
    }

    /**
     * Makes the {@code k}-th open (1-based) throw.
     */
    public FakeConnectionFactory failOnOpen(int k) {
        this.failOnOpen = k;
        return this;
    }

    @Override
    public synchronized GraphConnection open(PoolConfig config) {
        attempts++;
        if (attempts == failOnOpen) {
            throw new IllegalStateException("simulated connect failure #" + attempts);
        }
        FakeGraphConnection connection = new FakeGraphConnection(config.getGraphName(), handler);
        opened.add(connection);
        return connection;
    }

    public List<FakeGraphConnection> getOpened() {
        return opened;
    }

    public synchronized int getAttempts() {
        return attempts;
    }
}
