package com.knowledge.store.graph;

import java.time.Duration;

/**
 * Runtime exception thrown when no idle connection becomes available
 * within the configured acquire timeout. Callers may retry with backoff;
 * the pool itself never retries.
 */
public class AcquireTimeoutException extends RuntimeException {

    private final Duration timeout;

    public AcquireTimeoutException(Duration timeout) {
        super("Timeout waiting for connection (acquireTimeout=" + timeout.toMillis() + "ms)");
        this.timeout = timeout;
    }

    public AcquireTimeoutException(Duration timeout, Throwable cause) {
        super("Interrupted while waiting for connection (acquireTimeout=" + timeout.toMillis() + "ms)", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
