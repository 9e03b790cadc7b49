package com.knowledge.store.graph.schema;

/**
 * Thrown when the stored schema version has no transition in the migration
 * chain, either because the chain is broken or because the database was
 * migrated by a newer build. Fatal at startup.
 */
public class UnsupportedSchemaVersionException extends RuntimeException {

    private final String version;

    public UnsupportedSchemaVersionException(String version) {
        super("Unsupported schema version: " + version);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
