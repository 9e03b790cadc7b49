package com.knowledge.store.graph.schema;

import com.knowledge.store.graph.GraphConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Idempotent index creation. FalkorDB has no {@code IF NOT EXISTS} for
 * {@code CREATE INDEX}; an index that is already present is reported as an
 * error, which is treated here as success. Every other error propagates.
 */
public final class SchemaIndexes {
    private static final Logger log = LoggerFactory.getLogger(SchemaIndexes.class);

    private SchemaIndexes() {
        // utility class
    }

    /**
     * Runs an index creation statement.
     *
     * @return true if the index was created, false if it already existed
     */
    public static boolean createIfNotExists(GraphConnectionPool pool, String statement) {
        try {
            pool.executeSchema(statement);
            log.debug("Created index: {}", statement);
            return true;
        } catch (RuntimeException e) {
            if (isAlreadyIndexed(e)) {
                log.debug("Index already exists, skipping: {}", statement);
                return false;
            }
            throw e;
        }
    }

    static boolean isAlreadyIndexed(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("already indexed") || lower.contains("already exists")) {
                    return true;
                }
            }
        }
        return false;
    }
}
