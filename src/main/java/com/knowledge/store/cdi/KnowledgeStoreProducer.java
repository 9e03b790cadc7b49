package com.knowledge.store.cdi;

import com.knowledge.store.bootstrap.KnowledgeStore;
import com.knowledge.store.graph.GraphConnectionPool;
import com.knowledge.store.graph.InputSanitizer;
import com.knowledge.store.graph.PoolConfig;
import com.knowledge.store.health.HealthCheckRegistry;
import com.knowledge.store.metrics.MetricsService;
import com.knowledge.store.metrics.MicrometerMetricsService;
import com.knowledge.store.metrics.NoOpMetricsService;
import com.knowledge.store.search.AsyncSearchClient;
import com.knowledge.store.search.SearchConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that opens the knowledge store from MicroProfile Config properties.
 *
 * <p>The store is opened once per application and closed on shutdown. The
 * connection pool and search client are exposed as their own beans so that
 * callers can inject only what they use:</p>
 * <pre>
 * knowledge-store:
 *   graph:
 *     url: redis://localhost:6379
 *     user: knowledge_app
 *     password: ${GRAPH_PASSWORD}
 *   search:
 *     url: http://localhost:9200
 * </pre>
 *
 * <p>Produced beans are {@link Singleton}; the store types are not proxyable.</p>
 *
 * <p>When a Micrometer {@link MeterRegistry} bean is available, pool, migration
 * and search metrics are recorded to it.</p>
 */
@ApplicationScoped
public class KnowledgeStoreProducer {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStoreProducer.class);

    // ── Graph database ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.url", defaultValue = "redis://localhost:6379")
    String graphUrl;

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.namespace", defaultValue = "knowledge")
    String graphNamespace;

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.database", defaultValue = "facts")
    String graphDatabase;

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.user")
    String graphUser;

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.password")
    String graphPassword;

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.pool-size", defaultValue = "5")
    int poolSize;

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.acquire-timeout-millis", defaultValue = "10000")
    long acquireTimeoutMillis;

    @Inject
    @ConfigProperty(name = "knowledge-store.graph.embedding-dimension", defaultValue = "768")
    int embeddingDimension;

    // ── Search cluster ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-store.search.url", defaultValue = "http://localhost:9200")
    String searchUrl;

    @Inject
    @ConfigProperty(name = "knowledge-store.search.connections-per-node", defaultValue = "25")
    int connectionsPerNode;

    @Inject
    @ConfigProperty(name = "knowledge-store.search.request-timeout-seconds", defaultValue = "10")
    int requestTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "knowledge-store.search.shards", defaultValue = "1")
    int shards;

    @Inject
    @ConfigProperty(name = "knowledge-store.search.replicas", defaultValue = "0")
    int replicas;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public KnowledgeStore knowledgeStore() {
        PoolConfig poolConfig = poolConfig();
        SearchConfig searchConfig = searchConfig();
        log.info("Opening knowledge store: graph={} search={}", poolConfig, searchConfig);
        return KnowledgeStore.open(poolConfig, searchConfig, metricsService());
    }

    public void closeStore(@Disposes KnowledgeStore store) {
        log.info("Closing knowledge store");
        store.close();
    }

    @Produces
    @Singleton
    public GraphConnectionPool connectionPool(KnowledgeStore store) {
        return store.getConnectionPool();
    }

    @Produces
    @Singleton
    public AsyncSearchClient searchClient(KnowledgeStore store) {
        return store.getSearchClient();
    }

    @Produces
    @Singleton
    public HealthCheckRegistry healthCheckRegistry(KnowledgeStore store) {
        return HealthCheckRegistry.forStore(store);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    PoolConfig poolConfig() {
        InputSanitizer.validateCredential("knowledge-store.graph.user", graphUser);
        InputSanitizer.validateCredential("knowledge-store.graph.password", graphPassword);
        return PoolConfig.builder()
                .endpoint(graphUrl)
                .namespace(graphNamespace)
                .database(graphDatabase)
                .credentials(graphUser, graphPassword)
                .size(poolSize)
                .acquireTimeout(Duration.ofMillis(acquireTimeoutMillis))
                .embeddingDimension(embeddingDimension)
                .build();
    }

    SearchConfig searchConfig() {
        return SearchConfig.builder()
                .endpoint(searchUrl)
                .connectionsPerNode(connectionsPerNode)
                .requestTimeout(Duration.ofSeconds(requestTimeoutSeconds))
                .numberOfShards(shards)
                .numberOfReplicas(replicas)
                .build();
    }

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
