package com.knowledge.store.graph;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

/**
 * Configuration for {@link BoundedGraphConnectionPool}.
 * Validation happens in the builder so that a malformed endpoint or sizing
 * value never reaches the pool.
 */
public class PoolConfig {

    /** Endpoint schemes accepted for the graph database. */
    public static final Set<String> ALLOWED_SCHEMES = Set.of("redis", "falkor");

    private final URI endpoint;
    private final String namespace;
    private final String database;
    private final String user;
    private final String password;
    private final int size;
    private final Duration acquireTimeout;
    private final int embeddingDimension;

    private PoolConfig(Builder builder) {
        this.endpoint = builder.endpoint;
        this.namespace = builder.namespace;
        this.database = builder.database;
        this.user = builder.user;
        this.password = builder.password;
        this.size = builder.size;
        this.acquireTimeout = builder.acquireTimeout;
        this.embeddingDimension = builder.embeddingDimension;
    }

    public URI getEndpoint() { return endpoint; }
    public String getHost() { return endpoint.getHost(); }
    public int getPort() { return endpoint.getPort() > 0 ? endpoint.getPort() : 6379; }
    public String getNamespace() { return namespace; }
    public String getDatabase() { return database; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public int getSize() { return size; }
    public Duration getAcquireTimeout() { return acquireTimeout; }
    public int getEmbeddingDimension() { return embeddingDimension; }

    public boolean hasCredentials() {
        return user != null && password != null;
    }

    /**
     * Name of the graph selected for this namespace/database pair.
     */
    public String getGraphName() {
        return namespace + "_" + database;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private URI endpoint = URI.create("redis://localhost:6379");
        private String namespace = "knowledge";
        private String database = "facts";
        private String user;
        private String password;
        private int size = 5;
        private Duration acquireTimeout = Duration.ofSeconds(10);
        private int embeddingDimension = 768;

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
                throw new IllegalArgumentException("endpoint must use one of " + ALLOWED_SCHEMES
                        + " and name a host, got: " + endpoint);
            }
            this.endpoint = uri;
            return this;
        }

        public Builder namespace(String namespace) {
            InputSanitizer.validateIdentifier("namespace", namespace);
            this.namespace = namespace;
            return this;
        }

        public Builder database(String database) {
            InputSanitizer.validateIdentifier("database", database);
            this.database = database;
            return this;
        }

        public Builder credentials(String user, String password) {
            if (user == null || user.isBlank() || password == null || password.isEmpty()) {
                throw new IllegalArgumentException("user and password must both be provided");
            }
            this.user = user;
            this.password = password;
            return this;
        }

        public Builder size(int size) {
            if (size <= 0) throw new IllegalArgumentException("size must be > 0");
            this.size = size;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            if (acquireTimeout == null || acquireTimeout.isNegative() || acquireTimeout.isZero()) {
                throw new IllegalArgumentException("acquireTimeout must be > 0");
            }
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder embeddingDimension(int embeddingDimension) {
            if (embeddingDimension <= 0) throw new IllegalArgumentException("embeddingDimension must be > 0");
            this.embeddingDimension = embeddingDimension;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "endpoint=" + endpoint +
                ", namespace='" + namespace + '\'' +
                ", database='" + database + '\'' +
                ", credentials=" + (hasCredentials() ? "****" : "none") +
                ", size=" + size +
                ", acquireTimeout=" + acquireTimeout +
                ", embeddingDimension=" + embeddingDimension +
                '}';
    }
}
