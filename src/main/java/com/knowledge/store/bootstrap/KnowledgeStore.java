package com.knowledge.store.bootstrap;

import com.knowledge.store.graph.GraphConnectionPool;
import com.knowledge.store.graph.FalkorDBConnection;
import com.knowledge.store.graph.PoolConfig;
import com.knowledge.store.metrics.MetricsService;
import com.knowledge.store.metrics.NoOpMetricsService;
import com.knowledge.store.search.AsyncSearchClient;
import com.knowledge.store.search.ElasticsearchClientFactory;
import com.knowledge.store.search.SearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Process-wide holder of the graph connection pool and the search client.
 * Opened once at startup, closed once at shutdown in reverse creation order.
 */
public class KnowledgeStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    private final GraphConnectionPool connectionPool;
    private final AsyncSearchClient searchClient;

    KnowledgeStore(GraphConnectionPool connectionPool, AsyncSearchClient searchClient) {
        this.connectionPool = connectionPool;
        this.searchClient = searchClient;
    }

    public static KnowledgeStore open(PoolConfig poolConfig, SearchConfig searchConfig) {
        return open(poolConfig, searchConfig, new NoOpMetricsService());
    }

    public static KnowledgeStore open(PoolConfig poolConfig, SearchConfig searchConfig, MetricsService metrics) {
        return open(() -> KnowledgeStoreFactory.createConnectionPool(poolConfig, FalkorDBConnection::open, metrics),
                () -> KnowledgeStoreFactory.createSearchClient(searchConfig,
                        ElasticsearchClientFactory.create(searchConfig), metrics));
    }

    /**
     * Creates the pool first, then the search client. If the search client
     * cannot be created the pool is closed before the failure propagates.
     */
    public static KnowledgeStore open(Supplier<GraphConnectionPool> poolFactory,
                                      Supplier<AsyncSearchClient> searchClientFactory) {
        GraphConnectionPool pool = poolFactory.get();
        log.info("Initialized graph connection pool");
        AsyncSearchClient searchClient;
        try {
            searchClient = searchClientFactory.get();
        } catch (RuntimeException e) {
            log.error("Failed to initialize search client, closing graph connection pool", e);
            closePool(pool);
            throw e;
        }
        log.info("Initialized search client");
        return new KnowledgeStore(pool, searchClient);
    }

    public GraphConnectionPool getConnectionPool() {
        return connectionPool;
    }

    public AsyncSearchClient getSearchClient() {
        return searchClient;
    }

    @Override
    public void close() {
        try {
            searchClient.close();
        } catch (Exception e) {
            log.error("Failed to close search client cleanly", e);
        }
        closePool(connectionPool);
    }

    private static void closePool(GraphConnectionPool pool) {
        try {
            pool.close();
        } catch (Exception e) {
            log.error("Failed to close graph connection pool cleanly", e);
        }
    }
}
