package com.knowledge.store.bootstrap;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.CreateIndexResponse;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import com.knowledge.store.graph.BoundedGraphConnectionPool;
import com.knowledge.store.graph.FakeConnectionFactory;
import com.knowledge.store.graph.FakeGraphConnection;
import com.knowledge.store.graph.GraphConnectionPool;
import com.knowledge.store.graph.PoolConfig;
import com.knowledge.store.graph.schema.KnowledgeGraphSchema;
import com.knowledge.store.graph.schema.SchemaMigrator;
import com.knowledge.store.graph.schema.UnsupportedSchemaVersionException;
import com.knowledge.store.metrics.NoOpMetricsService;
import com.knowledge.store.search.AsyncSearchClient;
import com.knowledge.store.search.SearchConfig;
import com.knowledge.store.search.SearchUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KnowledgeStoreFactoryTest {

    private static final PoolConfig POOL_CONFIG = PoolConfig.builder()
            .namespace("test")
            .database("factory")
            .size(2)
            .build();

    @Nested
    @DisplayName("createConnectionPool")
    class CreateConnectionPool {

        @Test
        @DisplayName("Should return an initialized pool with the schema applied")
        void testCreatesMigratedPool() {
            FakeConnectionFactory factory = new FakeConnectionFactory();

            GraphConnectionPool pool = KnowledgeStoreFactory.createConnectionPool(
                    POOL_CONFIG, factory, new NoOpMetricsService());
            try {
                assertTrue(pool.isInitialized());
                assertEquals(2, pool.getStats().idleConnections());
                boolean vectorIndexCreated = factory.getOpened().stream()
                        .flatMap(c -> c.getStatements().stream())
                        .anyMatch(s -> s.startsWith("CREATE VECTOR INDEX"));
                assertTrue(vectorIndexCreated);
            } finally {
                pool.close();
            }
        }

        @Test
        @DisplayName("Should close the pool when the migration fails")
        void testClosesPoolOnMigrationFailure() {
            FakeConnectionFactory factory = new FakeConnectionFactory((statement, params) -> {
                if (statement.startsWith("CREATE VECTOR INDEX")) {
                    throw new IllegalStateException("errMsg: vector index not supported");
                }
                return List.of();
            });

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> KnowledgeStoreFactory.createConnectionPool(POOL_CONFIG, factory, new NoOpMetricsService()));

            assertTrue(e.getMessage().contains("vector index"));
            assertTrue(factory.getOpened().stream().allMatch(FakeGraphConnection::isClosed));
        }

        @Test
        @DisplayName("Should not return a pool whose stored version is unknown")
        void testClosesPoolOnUnsupportedVersion() {
            BoundedGraphConnectionPool pool = new BoundedGraphConnectionPool(POOL_CONFIG, new FakeConnectionFactory());

            assertThrows(UnsupportedSchemaVersionException.class,
                    () -> KnowledgeStoreFactory.createConnectionPool(pool, p -> new SchemaMigrator(p,
                            new FixedVersionStore("99"),
                            KnowledgeGraphSchema.migrationChain(8))));

            assertFalse(pool.isInitialized());
        }

        @Test
        @DisplayName("Should propagate connection failures without a pool to close")
        void testInitFailure() {
            FakeConnectionFactory factory = new FakeConnectionFactory().failOnOpen(2);

            assertThrows(IllegalStateException.class,
                    () -> KnowledgeStoreFactory.createConnectionPool(POOL_CONFIG, factory, new NoOpMetricsService()));
            assertTrue(factory.getOpened().get(0).isClosed());
        }
    }

    @Nested
    @DisplayName("createSearchClient")
    class CreateSearchClient {

        @Mock
        private ElasticsearchClient elasticsearch;

        @Mock
        private ElasticsearchTransport transport;

        @Mock
        private ElasticsearchIndicesClient indices;

        private final SearchConfig config = SearchConfig.builder().connectionsPerNode(2).build();

        @Test
        @DisplayName("Should return an initialized client with every index provisioned")
        void testCreatesProvisionedClient() throws IOException {
            when(elasticsearch.ping()).thenReturn(new BooleanResponse(true));
            when(elasticsearch.indices()).thenReturn(indices);
            when(elasticsearch._transport()).thenReturn(transport);
            when(indices.create(any(CreateIndexRequest.class)))
                    .thenReturn(CreateIndexResponse.of(r -> r.index("created").acknowledged(true)
                            .shardsAcknowledged(true)));

            AsyncSearchClient client = KnowledgeStoreFactory.createSearchClient(
                    config, elasticsearch, new NoOpMetricsService());
            try {
                assertTrue(client.isInitialized());
                verify(indices, times(2)).create(any(CreateIndexRequest.class));
            } finally {
                client.close();
            }
        }

        @Test
        @DisplayName("Should close the client and surface the cluster error when provisioning fails")
        void testClosesClientOnProvisioningFailure() throws IOException {
            when(elasticsearch.ping()).thenReturn(new BooleanResponse(true));
            when(elasticsearch.indices()).thenReturn(indices);
            when(elasticsearch._transport()).thenReturn(transport);
            when(indices.create(any(CreateIndexRequest.class))).thenThrow(new ElasticsearchException(
                    "indices.create", ErrorResponse.of(r -> r.status(400)
                            .error(e -> e.type("illegal_argument_exception").reason("bad mapping")))));

            ElasticsearchException e = assertThrows(ElasticsearchException.class,
                    () -> KnowledgeStoreFactory.createSearchClient(config, elasticsearch, new NoOpMetricsService()));

            assertEquals("illegal_argument_exception", e.error().type());
            verify(transport).close();
        }

        @Test
        @DisplayName("Should close the client when the cluster is unreachable")
        void testClosesClientOnPingFailure() throws IOException {
            when(elasticsearch.ping()).thenThrow(new IOException("Connection refused"));
            when(elasticsearch._transport()).thenReturn(transport);

            assertThrows(SearchUnavailableException.class,
                    () -> KnowledgeStoreFactory.createSearchClient(config, elasticsearch, new NoOpMetricsService()));

            verify(transport).close();
            verify(elasticsearch, never()).indices();
        }
    }
}
