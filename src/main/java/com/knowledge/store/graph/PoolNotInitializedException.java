package com.knowledge.store.graph;

/**
 * Thrown when the pool is used before {@link GraphConnectionPool#init()} succeeded
 * or after it was closed.
 */
public class PoolNotInitializedException extends IllegalStateException {

    public static final String MESSAGE = "Connection pool not initialized; call init() before acquire()";

    public PoolNotInitializedException() {
        super(MESSAGE);
    }
}
