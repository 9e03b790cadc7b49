package com.knowledge.store.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMigration("knowledge", "facts")) {
 *     log.info("schema.migrated version={}", version);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a schema migration run.
     */
    public static LogContext forMigration(String namespace, String database) {
        LogContext ctx = new LogContext();
        ctx.put("operation", "migrate");
        ctx.put("namespace", namespace);
        ctx.put("database", database);
        return ctx;
    }

    /**
     * Creates a log context for a search engine call.
     */
    public static LogContext forSearch(String operation, String index) {
        LogContext ctx = new LogContext();
        ctx.put("operation", operation);
        if (index != null) {
            ctx.put("index", index);
        }
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
