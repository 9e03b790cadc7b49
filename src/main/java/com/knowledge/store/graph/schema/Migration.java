package com.knowledge.store.graph.schema;

import com.knowledge.store.graph.GraphConnectionPool;

/**
 * One idempotent schema change. Running it again after a crash between the
 * change and the version update must succeed without error.
 */
@FunctionalInterface
public interface Migration {

    void apply(GraphConnectionPool pool);
}
