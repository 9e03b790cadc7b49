package com.knowledge.store.graph.schema;

/**
 * Transition of the migration chain: the version reached and the migration
 * that reaches it.
 *
 * @param nextVersion the schema version after the migration ran
 * @param migration   the idempotent migration procedure
 */
public record MigrationStep(String nextVersion, Migration migration) {

    public MigrationStep {
        if (nextVersion == null || nextVersion.isBlank()) {
            throw new IllegalArgumentException("nextVersion must not be blank");
        }
        if (migration == null) {
            throw new IllegalArgumentException("migration must not be null");
        }
    }
}
