package com.knowledge.store.graph;

import java.util.List;
import java.util.Map;

/**
 * A single session against one graph of the graph database.
 * Abstracts the underlying driver so the pool and the schema migrator
 * can be exercised without a running server.
 *
 * <p>Implementations are not required to be thread-safe: the pool hands a
 * connection to one caller at a time.</p>
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement and returns its result rows.
     *
     * @param statement the Cypher statement
     * @param params    statement parameters, referenced as {@code $name}
     * @return list of result records as maps, empty for statements without a RETURN clause
     */
    List<Map<String, Object>> query(String statement, Map<String, Object> params);

    /**
     * Executes a Cypher statement without parameters and returns its result rows.
     *
     * @param statement the Cypher statement
     * @return list of result records as maps
     */
    default List<Map<String, Object>> query(String statement) {
        return query(statement, Map.of());
    }

    /**
     * Gets the name of the graph this connection selected.
     *
     * @return graph name
     */
    String getGraphName();

    /**
     * Closes the session. Implementations may throw driver specific runtime exceptions.
     */
    @Override
    void close();
}
