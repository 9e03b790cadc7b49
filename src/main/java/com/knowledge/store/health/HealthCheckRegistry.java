package com.knowledge.store.health;

import com.knowledge.store.bootstrap.KnowledgeStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs registered checks and folds them into one status: the worst individual
 * status wins, and each check's result is attached as a detail under its name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new ArrayList<>();

    /**
     * Registry with the pool, graph database and search cluster checks of {@code store}.
     */
    public static HealthCheckRegistry forStore(KnowledgeStore store) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new ConnectionPoolHealthCheck(store.getConnectionPool()));
        registry.register(new GraphDatabaseHealthCheck(store.getConnectionPool()));
        registry.register(new SearchClientHealthCheck(store.getSearchClient()));
        return registry;
    }

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return new HealthStatus(HealthStatus.Status.UP, "No health checks registered", Map.of());
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "summary", String.valueOf(result.summary()),
                    "details", result.details()
            ));
            if (result.isWorseThan(worst)) {
                worst = result.status();
                worstMessage = check.getName() + ": " + result.summary();
            }
        }

        return new HealthStatus(worst, worstMessage, results);
    }

    public int size() {
        return checks.size();
    }
}
