package com.knowledge.store.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * In-memory {@link GraphConnection} for tests. Records every statement it
 * receives and answers with a configurable handler.
 */
public class FakeGraphConnection implements GraphConnection {

    private final String graphName;
    private final BiFunction<String, Map<String, Object>, List<Map<String, Object>>> handler;
    private final List<String> statements = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean closed;

    public FakeGraphConnection(String graphName) {
        this(graphName, (statement, params) -> List.of());
    }

    public FakeGraphConnection(String graphName,
                               BiFunction<String, Map<String, Object>, List<Map<String, Object>>> handler) {
        this.graphName = graphName;
        this.handler = handler;
    }

    @Override
    public List<Map<String, Object>> query(String statement, Map<String, Object> params) {
        if (closed) {
            throw new IllegalStateException("connection closed");
        }
        statements.add(statement);
        return handler.apply(statement, params);
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<String> getStatements() {
        return List.copyOf(statements);
    }
}
