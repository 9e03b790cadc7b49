package com.knowledge.store.graph.schema;

import java.time.Instant;

/**
 * Persisted schema version of one namespace/database pair.
 *
 * @param namespace      the namespace
 * @param database       the database
 * @param currentVersion the last schema version fully applied
 * @param appliedAt      when that version was recorded, may be null if the store does not track it
 */
public record SchemaVersionRecord(String namespace, String database, String currentVersion, Instant appliedAt) {
}
