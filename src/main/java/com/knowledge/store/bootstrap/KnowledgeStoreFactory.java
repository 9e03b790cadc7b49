package com.knowledge.store.bootstrap;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.knowledge.store.graph.BoundedGraphConnectionPool;
import com.knowledge.store.graph.FalkorDBConnection;
import com.knowledge.store.graph.GraphConnectionFactory;
import com.knowledge.store.graph.GraphConnectionPool;
import com.knowledge.store.graph.PoolConfig;
import com.knowledge.store.graph.schema.SchemaMigrator;
import com.knowledge.store.metrics.MetricsService;
import com.knowledge.store.metrics.NoOpMetricsService;
import com.knowledge.store.search.AsyncSearchClient;
import com.knowledge.store.search.ElasticsearchClientFactory;
import com.knowledge.store.search.SearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Builds ready-to-use connection components. Nothing half-initialized is
 * ever handed back: when a step after construction fails, the component is
 * closed and the failure rethrown.
 */
public final class KnowledgeStoreFactory {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStoreFactory.class);

    private KnowledgeStoreFactory() {
    }

    public static GraphConnectionPool createConnectionPool(PoolConfig config) {
        return createConnectionPool(config, FalkorDBConnection::open, new NoOpMetricsService());
    }

    /**
     * Creates, initializes and schema-migrates a connection pool.
     */
    public static GraphConnectionPool createConnectionPool(PoolConfig config, GraphConnectionFactory connectionFactory,
                                                           MetricsService metrics) {
        return createConnectionPool(new BoundedGraphConnectionPool(config, connectionFactory, metrics),
                pool -> SchemaMigrator.forKnowledgeGraph(pool, metrics));
    }

    /**
     * Initializes {@code pool} and runs the migrator built for it. On migration
     * failure the pool is closed before the failure propagates.
     */
    public static GraphConnectionPool createConnectionPool(GraphConnectionPool pool,
                                                           Function<GraphConnectionPool, SchemaMigrator> migratorFactory) {
        pool.init();
        try {
            migratorFactory.apply(pool).migrate();
        } catch (RuntimeException e) {
            log.error("Schema migration failed, closing connection pool", e);
            pool.close();
            throw e;
        }
        return pool;
    }

    public static AsyncSearchClient createSearchClient(SearchConfig config) {
        return createSearchClient(config, ElasticsearchClientFactory.create(config), new NoOpMetricsService());
    }

    /**
     * Creates, initializes and provisions the indices of a search client.
     * On failure the client is closed before the failure propagates.
     */
    public static AsyncSearchClient createSearchClient(SearchConfig config, ElasticsearchClient client,
                                                       MetricsService metrics) {
        AsyncSearchClient searchClient = new AsyncSearchClient(client, config, metrics);
        try {
            searchClient.init();
            searchClient.initializeIndices().join();
        } catch (CompletionException e) {
            log.error("Index provisioning failed, closing search client", e.getCause());
            searchClient.close();
            throw unwrap(e);
        } catch (RuntimeException e) {
            log.error("Search client initialization failed, closing it", e);
            searchClient.close();
            throw e;
        }
        return searchClient;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return e;
    }
}
