package com.knowledge.store.graph.schema;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit table of schema transitions keyed by the <em>current</em> version.
 *
 * <p>The initial step applies when no version record exists. {@link Builder#build()}
 * walks the chain from there and from every declared version, and rejects
 * tables where any of these walks does not reach the latest version, so a
 * broken chain fails at construction rather than at startup against a live
 * database.</p>
 */
public final class MigrationChain {

    private final MigrationStep initialStep;
    private final Map<String, MigrationStep> steps;
    private final String latestVersion;

    private MigrationChain(Builder builder) {
        this.initialStep = builder.initialStep;
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(builder.steps));
        this.latestVersion = builder.latestVersion;
    }

    /**
     * Returns the step to apply from the given version.
     *
     * @param currentVersion the stored version, or {@code null} when no record exists
     * @return the next step, or empty when the version is unknown to this chain
     */
    public Optional<MigrationStep> next(String currentVersion) {
        if (currentVersion == null) {
            return Optional.of(initialStep);
        }
        return Optional.ofNullable(steps.get(currentVersion));
    }

    public String getLatestVersion() {
        return latestVersion;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MigrationStep initialStep;
        private final Map<String, MigrationStep> steps = new LinkedHashMap<>();
        private String latestVersion;

        /**
         * Declares the step applied when no version record exists.
         */
        public Builder initial(String nextVersion, Migration migration) {
            this.initialStep = new MigrationStep(nextVersion, migration);
            return this;
        }

        /**
         * Declares the step applied when the stored version is {@code fromVersion}.
         */
        public Builder step(String fromVersion, String nextVersion, Migration migration) {
            if (fromVersion == null || fromVersion.isBlank()) {
                throw new IllegalArgumentException("fromVersion must not be blank");
            }
            if (steps.containsKey(fromVersion)) {
                throw new IllegalArgumentException("Duplicate migration from version " + fromVersion);
            }
            steps.put(fromVersion, new MigrationStep(nextVersion, migration));
            return this;
        }

        public Builder latest(String latestVersion) {
            this.latestVersion = latestVersion;
            return this;
        }

        public MigrationChain build() {
            if (initialStep == null) {
                throw new IllegalStateException("Migration chain needs an initial step");
            }
            if (latestVersion == null || latestVersion.isBlank()) {
                throw new IllegalStateException("Migration chain needs a latest version");
            }

            requireReachesLatest(initialStep.nextVersion());
            for (String fromVersion : steps.keySet()) {
                requireReachesLatest(fromVersion);
            }
            return new MigrationChain(this);
        }

        private void requireReachesLatest(String start) {
            Set<String> visited = new HashSet<>();
            String version = start;
            while (!version.equals(latestVersion)) {
                if (!visited.add(version)) {
                    throw new IllegalStateException("Migration chain has a cycle at version " + version);
                }
                MigrationStep step = steps.get(version);
                if (step == null) {
                    throw new IllegalStateException("Migration chain is broken: no step from version "
                            + version + " towards " + latestVersion);
                }
                version = step.nextVersion();
            }
        }
    }
}
