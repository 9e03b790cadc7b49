package com.knowledge.store.graph.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MigrationChainTest {

    private static final Migration NOOP = pool -> { };

    @Test
    @DisplayName("Should return the initial step when no version is recorded")
    void testInitialStep() {
        MigrationChain chain = MigrationChain.builder()
                .initial("1", NOOP)
                .latest("1")
                .build();

        assertEquals("1", chain.next(null).orElseThrow().nextVersion());
        assertTrue(chain.next("1").isEmpty());
        assertEquals("1", chain.getLatestVersion());
    }

    @Test
    @DisplayName("Should look up steps by current version")
    void testStepsKeyedByCurrentVersion() {
        MigrationChain chain = MigrationChain.builder()
                .initial("1", NOOP)
                .step("1", "2", NOOP)
                .step("2", "3", NOOP)
                .latest("3")
                .build();

        assertEquals("2", chain.next("1").orElseThrow().nextVersion());
        assertEquals("3", chain.next("2").orElseThrow().nextVersion());
        assertTrue(chain.next("3").isEmpty());
        assertTrue(chain.next("7").isEmpty());
    }

    @Test
    @DisplayName("Should reject a chain that never reaches the latest version")
    void testBrokenChainRejected() {
        MigrationChain.Builder builder = MigrationChain.builder()
                .initial("1", NOOP)
                .step("2", "3", NOOP)
                .latest("3");

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("no step from version 1"));
    }

    @Test
    @DisplayName("Should reject a cyclic chain")
    void testCyclicChainRejected() {
        MigrationChain.Builder builder = MigrationChain.builder()
                .initial("1", NOOP)
                .step("1", "2", NOOP)
                .step("2", "1", NOOP)
                .latest("3");

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    @DisplayName("Should reject a cycle among steps off the path from the initial step")
    void testDetachedCycleRejected() {
        MigrationChain.Builder builder = MigrationChain.builder()
                .initial("1", NOOP)
                .step("1", "4", NOOP)
                .step("2", "3", NOOP)
                .step("3", "2", NOOP)
                .latest("4");

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("cycle"));
    }

    @Test
    @DisplayName("Should reject a declared version that dead-ends before the latest version")
    void testDetachedDeadEndRejected() {
        MigrationChain.Builder builder = MigrationChain.builder()
                .initial("2", NOOP)
                .step("legacy", "1", NOOP)
                .step("2", "3", NOOP)
                .latest("3");

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("no step from version 1"));
    }

    @Test
    @DisplayName("Should require an initial step and a latest version")
    void testMissingEndsRejected() {
        assertThrows(IllegalStateException.class,
                () -> MigrationChain.builder().latest("1").build());
        assertThrows(IllegalStateException.class,
                () -> MigrationChain.builder().initial("1", NOOP).build());
    }

    @Test
    @DisplayName("Should reject duplicate transitions from the same version")
    void testDuplicateStepRejected() {
        MigrationChain.Builder builder = MigrationChain.builder().step("1", "2", NOOP);
        assertThrows(IllegalArgumentException.class, () -> builder.step("1", "3", NOOP));
    }

    @Test
    @DisplayName("Should reject steps without a target version or migration")
    void testInvalidStepRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MigrationStep(" ", NOOP));
        assertThrows(IllegalArgumentException.class, () -> new MigrationStep("2", null));
    }
}
