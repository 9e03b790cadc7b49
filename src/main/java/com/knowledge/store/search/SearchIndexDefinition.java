package com.knowledge.store.search;

import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;

/**
 * A named index and its field mapping.
 */
public record SearchIndexDefinition(String name, TypeMapping mappings) {
}
