package com.knowledge.store.graph.schema;

import java.util.Optional;

/**
 * Storage of the schema version record for one namespace/database pair.
 */
public interface SchemaVersionStore {

    /**
     * Creates whatever the store needs to track versions. Safe to call on every start.
     */
    void ensureVersionTracking();

    /**
     * Reads the version record, empty when no migration ever completed.
     */
    Optional<SchemaVersionRecord> read();

    /**
     * Records {@code version} as the current schema version, creating the record if needed.
     */
    void write(String version);
}
