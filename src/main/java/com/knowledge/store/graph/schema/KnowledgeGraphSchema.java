package com.knowledge.store.graph.schema;

import com.knowledge.store.graph.GraphConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Versioned schema of the knowledge graph: facts with a vector embedding,
 * entities, topics and the typed relations between them.
 */
public final class KnowledgeGraphSchema {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphSchema.class);

    public static final String LATEST_VERSION = "1";

    public static final String FACT = "Fact";
    public static final String ENTITY = "Entity";
    public static final String TOPIC = "Topic";

    /**
     * Relation types and the node labels they connect.
     */
    public enum RelationType {
        MENTIONS(FACT, ENTITY),
        HAS_SUBTOPIC(TOPIC, TOPIC),
        CONCERNS(FACT, TOPIC),
        OVERLAPS_WITH(FACT, FACT),
        CONTRADICTS(FACT, FACT),
        REFINES(FACT, FACT);

        private final String fromLabel;
        private final String toLabel;

        RelationType(String fromLabel, String toLabel) {
            this.fromLabel = fromLabel;
            this.toLabel = toLabel;
        }

        public String fromLabel() { return fromLabel; }
        public String toLabel() { return toLabel; }

        /**
         * Cypher pattern of this relation between its endpoint labels, e.g. {@code (:Fact)-[:MENTIONS]->(:Entity)}.
         */
        public String pattern() {
            return "(:" + fromLabel + ")-[:" + name() + "]->(:" + toLabel + ")";
        }
    }

    private KnowledgeGraphSchema() {
    }

    /**
     * The migration chain of this build: no record to version 1.
     */
    public static MigrationChain migrationChain(int embeddingDimension) {
        return MigrationChain.builder()
                .initial("1", pool -> applyVersion1(pool, embeddingDimension))
                .latest(LATEST_VERSION)
                .build();
    }

    /**
     * Statements creating the version 1 schema. Each one is an index creation,
     * so re-running them only reports indexes that already exist.
     */
    static List<String> version1Statements(int embeddingDimension) {
        List<String> statements = new ArrayList<>(List.of(
                "CREATE INDEX FOR (f:Fact) ON (f.source_file)",
                "CREATE INDEX FOR (e:Entity) ON (e.canonical_name)",
                "CREATE INDEX FOR (e:Entity) ON (e.entity_type)",
                "CREATE INDEX FOR (t:Topic) ON (t.name)",
                "CREATE INDEX FOR (t:Topic) ON (t.level)",
                "CREATE VECTOR INDEX FOR (f:Fact) ON (f.embedding) OPTIONS {dimension: "
                        + embeddingDimension + ", similarityFunction: 'cosine'}"
        ));
        for (RelationType relation : RelationType.values()) {
            statements.add("CREATE INDEX FOR ()-[r:" + relation.name() + "]-() ON (r.created_at)");
        }
        return statements;
    }

    private static void applyVersion1(GraphConnectionPool pool, int embeddingDimension) {
        int created = 0;
        List<String> statements = version1Statements(embeddingDimension);
        for (String statement : statements) {
            if (SchemaIndexes.createIfNotExists(pool, statement)) {
                created++;
            }
        }
        for (RelationType relation : RelationType.values()) {
            log.debug("created_at indexed for {}", relation.pattern());
        }
        log.info("Schema version 1 applied: {} of {} indexes created", created, statements.size());
    }
}
