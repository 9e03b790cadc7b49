package com.knowledge.store.search;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

/**
 * Configuration for {@link AsyncSearchClient} and the Elasticsearch client it wraps.
 */
public class SearchConfig {

    /** Endpoint schemes accepted for the search cluster. */
    public static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private final URI endpoint;
    private final int connectionsPerNode;
    private final Duration requestTimeout;
    private final int numberOfShards;
    private final int numberOfReplicas;

    private SearchConfig(Builder builder) {
        this.endpoint = builder.endpoint;
        this.connectionsPerNode = builder.connectionsPerNode;
        this.requestTimeout = builder.requestTimeout;
        this.numberOfShards = builder.numberOfShards;
        this.numberOfReplicas = builder.numberOfReplicas;
    }

    public URI getEndpoint() { return endpoint; }
    public int getConnectionsPerNode() { return connectionsPerNode; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public int getNumberOfShards() { return numberOfShards; }
    public int getNumberOfReplicas() { return numberOfReplicas; }

    /**
     * Number of worker threads blocking calls are offloaded to. One per
     * connection, so a worker never waits on the HTTP connection pool.
     */
    public int getWorkerThreads() {
        return connectionsPerNode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private URI endpoint = URI.create("http://localhost:9200");
        private int connectionsPerNode = 25;
        private Duration requestTimeout = Duration.ofSeconds(10);
        private int numberOfShards = 1;
        private int numberOfReplicas = 0;

        public Builder endpoint(String endpoint) {
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalArgumentException("endpoint must not be blank");
            }
            URI uri;
            try {
                uri = URI.create(endpoint);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("endpoint is not a valid URI: " + endpoint, e);
            }
            if (uri.getScheme() == null || !ALLOWED_SCHEMES.contains(uri.getScheme().toLowerCase())
                    || uri.getHost() == null) {
                throw new IllegalArgumentException("endpoint must use http or https and name a host, got: "
                        + endpoint);
            }
            if (uri.getUserInfo() != null) {
                throw new IllegalArgumentException("endpoint must not embed credentials");
            }
            if (uri.getQuery() != null || uri.getFragment() != null) {
                throw new IllegalArgumentException("endpoint must not have a query or fragment, got: " + endpoint);
            }
            this.endpoint = uri;
            return this;
        }

        public Builder connectionsPerNode(int connectionsPerNode) {
            if (connectionsPerNode <= 0) throw new IllegalArgumentException("connectionsPerNode must be > 0");
            this.connectionsPerNode = connectionsPerNode;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be > 0");
            }
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder numberOfShards(int numberOfShards) {
            if (numberOfShards <= 0) throw new IllegalArgumentException("numberOfShards must be > 0");
            this.numberOfShards = numberOfShards;
            return this;
        }

        public Builder numberOfReplicas(int numberOfReplicas) {
            if (numberOfReplicas < 0) throw new IllegalArgumentException("numberOfReplicas must be >= 0");
            this.numberOfReplicas = numberOfReplicas;
            return this;
        }

        public SearchConfig build() {
            return new SearchConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SearchConfig{" +
                "endpoint=" + endpoint +
                ", connectionsPerNode=" + connectionsPerNode +
                ", requestTimeout=" + requestTimeout +
                ", numberOfShards=" + numberOfShards +
                ", numberOfReplicas=" + numberOfReplicas +
                '}';
    }
}
