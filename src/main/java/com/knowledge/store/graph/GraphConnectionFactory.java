package com.knowledge.store.graph;

/**
 * Opens authenticated graph sessions for a {@link GraphConnectionPool}.
 * Each call performs connect, authenticate and graph selection, and either
 * returns a usable connection or throws.
 */
@FunctionalInterface
public interface GraphConnectionFactory {

    GraphConnection open(PoolConfig config);
}
