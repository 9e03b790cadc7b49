package com.knowledge.store.graph.schema;

import com.knowledge.store.graph.GraphConnectionPool;
import com.knowledge.store.graph.PoolConfig;
import com.knowledge.store.logging.LogContext;
import com.knowledge.store.metrics.MetricsService;
import com.knowledge.store.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the graph of a namespace/database pair to the latest schema version.
 *
 * <p>The stored version is advanced only after a step succeeded, so a crash
 * mid-migration leaves the previous version in place and the idempotent step
 * is simply applied again on the next start. Running the migrator against an
 * up-to-date graph has no side effects beyond the tracking index check.</p>
 */
public class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private final GraphConnectionPool pool;
    private final SchemaVersionStore versionStore;
    private final MigrationChain chain;
    private final MetricsService metrics;

    public SchemaMigrator(GraphConnectionPool pool, SchemaVersionStore versionStore, MigrationChain chain) {
        this(pool, versionStore, chain, new NoOpMetricsService());
    }

    public SchemaMigrator(GraphConnectionPool pool, SchemaVersionStore versionStore, MigrationChain chain,
                          MetricsService metrics) {
        this.pool = pool;
        this.versionStore = versionStore;
        this.chain = chain;
        this.metrics = metrics;
    }

    /**
     * Migrator for the knowledge graph schema, tracking versions inside the pooled graph.
     */
    public static SchemaMigrator forKnowledgeGraph(GraphConnectionPool pool, MetricsService metrics) {
        return new SchemaMigrator(pool,
                new GraphSchemaVersionStore(pool),
                KnowledgeGraphSchema.migrationChain(pool.getConfig().getEmbeddingDimension()),
                metrics);
    }

    /**
     * Applies every pending step of the chain.
     *
     * @return the schema version the graph is at afterwards
     * @throws UnsupportedSchemaVersionException if the stored version has no transition
     */
    public String migrate() {
        PoolConfig config = pool.getConfig();
        try (LogContext ctx = LogContext.forMigration(config.getNamespace(), config.getDatabase())) {
            versionStore.ensureVersionTracking();
            String current = versionStore.read().map(SchemaVersionRecord::currentVersion).orElse(null);
            String latest = chain.getLatestVersion();

            if (latest.equals(current)) {
                log.info("Graph schema already at version {} for namespace '{}' and database '{}'",
                        current, config.getNamespace(), config.getDatabase());
                return current;
            }

            while (!latest.equals(current)) {
                String from = current;
                MigrationStep step = chain.next(from)
                        .orElseThrow(() -> new UnsupportedSchemaVersionException(from));

                ctx.with("schemaVersion", step.nextVersion());
                log.info("Applying schema migration {} -> {}", from == null ? "none" : from, step.nextVersion());
                step.migration().apply(pool);
                current = step.nextVersion();
                versionStore.write(current);
                metrics.incrementMigrationApplied(current);
            }

            log.info("Graph schema migrated to version {} for namespace '{}' and database '{}'",
                    current, config.getNamespace(), config.getDatabase());
            return current;
        }
    }
}
