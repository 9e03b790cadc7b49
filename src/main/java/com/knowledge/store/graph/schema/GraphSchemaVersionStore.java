package com.knowledge.store.graph.schema;

import com.knowledge.store.graph.GraphConnectionPool;
import com.knowledge.store.graph.PoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the schema version as a {@code :SchemaVersion} node inside the graph.
 *
 * <p>The node is keyed by {@code id = <namespace>_<database>} and only ever
 * written through {@code MERGE} on that key, so there is at most one record
 * per namespace/database pair.</p>
 */
public class GraphSchemaVersionStore implements SchemaVersionStore {
    private static final Logger log = LoggerFactory.getLogger(GraphSchemaVersionStore.class);

    static final String VERSION_INDEX = "CREATE INDEX FOR (v:SchemaVersion) ON (v.id)";

    static final String READ_VERSION = """
            MATCH (v:SchemaVersion {id: $id})
            RETURN v.current_version AS current_version, v.applied_at AS applied_at
            LIMIT 1
            """;

    static final String WRITE_VERSION = """
            MERGE (v:SchemaVersion {id: $id})
            SET v.namespace = $namespace,
                v.database = $database,
                v.current_version = $version,
                v.applied_at = timestamp()
            """;

    private final GraphConnectionPool pool;
    private final String namespace;
    private final String database;

    public GraphSchemaVersionStore(GraphConnectionPool pool) {
        this.pool = pool;
        PoolConfig config = pool.getConfig();
        this.namespace = config.getNamespace();
        this.database = config.getDatabase();
    }

    @Override
    public void ensureVersionTracking() {
        SchemaIndexes.createIfNotExists(pool, VERSION_INDEX);
    }

    @Override
    public Optional<SchemaVersionRecord> read() {
        List<Map<String, Object>> rows = pool.executeSchema(READ_VERSION, Map.of("id", recordId()));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = rows.get(0);
        if (!(row.get("current_version") instanceof String version)) {
            log.debug("Schema version record for '{}' has no readable current_version: {}", recordId(), row);
            return Optional.empty();
        }
        Instant appliedAt = row.get("applied_at") instanceof Number millis
                ? Instant.ofEpochMilli(millis.longValue())
                : null;
        return Optional.of(new SchemaVersionRecord(namespace, database, version, appliedAt));
    }

    @Override
    public void write(String version) {
        pool.executeSchema(WRITE_VERSION, Map.of(
                "id", recordId(),
                "namespace", namespace,
                "database", database,
                "version", version
        ));
        log.debug("Recorded schema version {} for '{}'", version, recordId());
    }

    String recordId() {
        return namespace + "_" + database;
    }
}
