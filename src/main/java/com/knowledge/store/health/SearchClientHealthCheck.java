package com.knowledge.store.health;

import com.knowledge.store.search.AsyncSearchClient;

import java.util.concurrent.TimeUnit;

/**
 * Pings the search cluster through the async client.
 */
public class SearchClientHealthCheck implements HealthCheck {

    private final AsyncSearchClient client;

    public SearchClientHealthCheck(AsyncSearchClient client) {
        this.client = client;
    }

    @Override
    public String getName() {
        return "searchCluster";
    }

    @Override
    public HealthStatus check() {
        if (!client.isInitialized()) {
            return HealthStatus.down("Search client not initialized");
        }
        try {
            long startMs = System.currentTimeMillis();
            boolean reachable = client.ping()
                    .get(client.getConfig().getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS);
            HealthStatus base = reachable
                    ? HealthStatus.ok()
                    : HealthStatus.down("Search cluster refused ping");
            return base
                    .withLatencySince(startMs)
                    .withDetail("endpoint", client.getConfig().getEndpoint().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.down("Search cluster check interrupted");
        } catch (Exception e) {
            return HealthStatus.failure("Search cluster", e);
        }
    }
}
