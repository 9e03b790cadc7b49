package com.knowledge.store.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorCause;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.IndexSettings;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledge.store.logging.LogContext;
import com.knowledge.store.metrics.MetricsService;
import com.knowledge.store.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Async wrapper around the synchronous {@link ElasticsearchClient}.
 *
 * <p>Every blocking call is submitted to a fixed-size worker pool and
 * surfaces as a {@link CompletableFuture}, so callers are never blocked by
 * network I/O. Failures complete the future with the client's own exception.
 * Calls made before {@link #init()} succeeded throw
 * {@link SearchClientNotInitializedException} immediately.</p>
 */
public class AsyncSearchClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncSearchClient.class);

    static final String RESOURCE_ALREADY_EXISTS = "resource_already_exists_exception";

    private final ElasticsearchClient client;
    private final SearchConfig config;
    private final MetricsService metrics;
    private final ExecutorService executor;
    private volatile boolean initialized;

    public AsyncSearchClient(SearchConfig config) {
        this(ElasticsearchClientFactory.create(config), config, new NoOpMetricsService());
    }

    public AsyncSearchClient(ElasticsearchClient client, SearchConfig config, MetricsService metrics) {
        this.client = client;
        this.config = config;
        this.metrics = metrics;
        this.executor = Executors.newFixedThreadPool(config.getWorkerThreads(), workerThreadFactory());
    }

    @FunctionalInterface
    private interface BlockingCall<T> {
        T call() throws IOException;
    }

    /**
     * Pings the cluster and marks the client initialized.
     *
     * @throws SearchUnavailableException if the ping fails or is refused
     */
    public void init() {
        boolean reachable;
        try {
            reachable = submit("ping", null, () -> client.ping().value()).join();
        } catch (CompletionException e) {
            throw new SearchUnavailableException("Elasticsearch ping failed: " + e.getCause().getMessage(),
                    e.getCause());
        }
        if (!reachable) {
            throw new SearchUnavailableException("Elasticsearch did not answer ping at " + config.getEndpoint());
        }
        initialized = true;
        log.info("Elasticsearch client initialized: {}", config);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public SearchConfig getConfig() {
        return config;
    }

    /**
     * Pings the cluster without changing the initialized state.
     */
    public CompletableFuture<Boolean> ping() {
        ensureInitialized();
        return submit("ping", null, () -> client.ping().value());
    }

    public CompletableFuture<SearchResponse<ObjectNode>> search(String index, Query query) {
        ensureInitialized();
        SearchRequest request = SearchRequest.of(b -> b.index(index).query(query));
        return submit("search", index, () -> client.search(request, ObjectNode.class));
    }

    public CompletableFuture<IndexResponse> index(String index, Map<String, Object> document) {
        return index(index, document, null);
    }

    /**
     * Indexes a document.
     *
     * @param id the document id, or {@code null} to let the cluster assign one
     */
    public CompletableFuture<IndexResponse> index(String index, Map<String, Object> document, String id) {
        ensureInitialized();
        IndexRequest<Map<String, Object>> request = IndexRequest.of(b -> {
            b.index(index).document(document);
            if (id != null) {
                b.id(id);
            }
            return b;
        });
        return submit("index", index, () -> client.index(request));
    }

    public CompletableFuture<BulkResponse> bulk(List<BulkOperation> operations) {
        ensureInitialized();
        BulkRequest request = BulkRequest.of(b -> b.operations(operations));
        return submit("bulk", null, () -> client.bulk(request));
    }

    /**
     * Creates an index unless it already exists.
     *
     * @return a future completing with true if the index was created, false if it already existed
     */
    public CompletableFuture<Boolean> createIndex(String name, TypeMapping mappings, IndexSettings settings) {
        ensureInitialized();
        CreateIndexRequest request = CreateIndexRequest.of(b -> b
                .index(name)
                .mappings(mappings)
                .settings(settings));
        return submit("create_index", name, () -> {
            try {
                client.indices().create(request);
                metrics.incrementIndexProvisioned(name, true);
                return true;
            } catch (ElasticsearchException e) {
                if (isAlreadyExists(e)) {
                    log.debug("Index {} already exists; skipping creation", name);
                    metrics.incrementIndexProvisioned(name, false);
                    return false;
                }
                throw e;
            }
        });
    }

    /**
     * Creates every index in {@link KnowledgeIndices#all()} with the configured
     * shard and replica counts.
     */
    public CompletableFuture<Void> initializeIndices() {
        ensureInitialized();
        IndexSettings settings = IndexSettings.of(s -> s
                .numberOfShards(String.valueOf(config.getNumberOfShards()))
                .numberOfReplicas(String.valueOf(config.getNumberOfReplicas())));

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (SearchIndexDefinition definition : KnowledgeIndices.all()) {
            chain = chain.thenCompose(ignored -> createIndex(definition.name(), definition.mappings(), settings)
                    .thenAccept(created -> log.info("Index {} {}", definition.name(),
                            created ? "created" : "already present")));
        }
        return chain;
    }

    /**
     * Closes the transport and stops the worker pool. Close failures are logged.
     */
    @Override
    public void close() {
        initialized = false;
        try {
            client._transport().close();
        } catch (IOException e) {
            log.warn("Failed to close Elasticsearch transport: {}", e.getMessage());
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Elasticsearch client closed");
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new SearchClientNotInitializedException();
        }
    }

    private <T> CompletableFuture<T> submit(String operation, String index, BlockingCall<T> call) {
        CompletableFuture<T> future = new CompletableFuture<>();
        executor.execute(() -> {
            long startNanos = System.nanoTime();
            try (LogContext ctx = LogContext.forSearch(operation, index)) {
                T result = call.call();
                metrics.recordSearchRequest(operation, Duration.ofNanos(System.nanoTime() - startNanos), true);
                future.complete(result);
            } catch (Throwable t) {
                // Errors included: init() joins on this future
                metrics.recordSearchRequest(operation, Duration.ofNanos(System.nanoTime() - startNanos), false);
                log.debug("Search call {} failed: {}", operation, t.toString());
                future.completeExceptionally(t);
            }
        });
        return future;
    }

    static boolean isAlreadyExists(ElasticsearchException e) {
        ErrorCause error = e.error();
        return error != null && RESOURCE_ALREADY_EXISTS.equals(error.type());
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "search-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
