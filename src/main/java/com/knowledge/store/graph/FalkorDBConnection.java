package com.knowledge.store.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * FalkorDB-specific implementation using the JFalkorDB client.
 *
 * <p>FalkorDB has no namespaces: the namespace/database pair selects the graph
 * named {@link PoolConfig#getGraphName()}. Each instance owns its own
 * {@link Driver} because JFalkorDB's {@code Graph} is not thread-safe.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    FalkorDBConnection(Driver driver, String graphName) {
        this.driver = driver;
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
    }

    /**
     * Connects, authenticates when credentials are configured, selects the graph
     * and probes it with {@code RETURN 1} so that bad endpoints or credentials
     * fail here rather than on first use.
     */
    public static FalkorDBConnection open(PoolConfig config) {
        Driver driver = config.hasCredentials()
                ? FalkorDB.driver(config.getHost(), config.getPort(), config.getUser(), config.getPassword())
                : FalkorDB.driver(config.getHost(), config.getPort());
        try {
            FalkorDBConnection connection = new FalkorDBConnection(driver, config.getGraphName());
            connection.graph.query("RETURN 1");
            log.debug("FalkorDB connection opened for graph: {}", config.getGraphName());
            return connection;
        } catch (RuntimeException e) {
            try {
                closeDriver(driver);
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @Override
    public List<Map<String, Object>> query(String statement, Map<String, Object> params) {
        log.debug("Querying: {}", statement);

        ResultSet resultSet = params == null || params.isEmpty()
                ? graph.query(statement)
                : graph.query(statement, params);
        List<Map<String, Object>> results = new ArrayList<>();

        for (Record record : resultSet) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void close() {
        closeDriver(driver);
        log.debug("FalkorDB connection closed for graph: {}", graphName);
    }

    private static void closeDriver(Driver driver) {
        try {
            driver.close();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to close FalkorDB driver", e);
        }
    }
}
