package com.knowledge.store.search;

import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;

import java.util.List;

/**
 * Indices the knowledge service depends on.
 */
public final class KnowledgeIndices {

    public static final String FACTS_INDEX = "facts_index";
    public static final String ENTITY_ALIASES_INDEX = "entity_aliases_index";

    public static final SearchIndexDefinition FACTS = new SearchIndexDefinition(FACTS_INDEX,
            TypeMapping.of(m -> m
                    .properties("text", p -> p.text(t -> t))
                    .properties("standardized_text", p -> p.text(t -> t))
                    .properties("source_file", p -> p.keyword(k -> k))
                    .properties("entity_ids", p -> p.keyword(k -> k))
                    .properties("topic_ids", p -> p.keyword(k -> k))));

    public static final SearchIndexDefinition ENTITY_ALIASES = new SearchIndexDefinition(ENTITY_ALIASES_INDEX,
            TypeMapping.of(m -> m
                    .properties("canonical_name", p -> p.keyword(k -> k))
                    .properties("alias", p -> p.text(t -> t))
                    .properties("entity_type", p -> p.keyword(k -> k))));

    private KnowledgeIndices() {
    }

    public static List<SearchIndexDefinition> all() {
        return List.of(FACTS, ENTITY_ALIASES);
    }
}
