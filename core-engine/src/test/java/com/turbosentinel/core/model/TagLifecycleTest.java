package com.turbosentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TagLifecycle}.
 */
class TagLifecycleTest {

    @Test
    @DisplayName("Should walk the happy path to ACTIONABLE")
    void shouldFollowHappyPath() {
        TagLifecycle lifecycle = new TagLifecycle("T1");
        assertThat(lifecycle.getState()).isEqualTo(TagLifecycleState.UNSCORED);

        lifecycle.transitionTo(TagLifecycleState.CANDIDATE_GENERATED);
        lifecycle.transitionTo(TagLifecycleState.VERIFIED);
        lifecycle.transitionTo(TagLifecycleState.SCORED);
        lifecycle.transitionTo(TagLifecycleState.ACTIONABLE);

        assertThat(lifecycle.getState()).isEqualTo(TagLifecycleState.ACTIONABLE);
    }

    @Test
    @DisplayName("Should allow scoring after rejection")
    void shouldScoreRejectedTag() {
        TagLifecycle lifecycle = new TagLifecycle("T1");
        lifecycle.transitionTo(TagLifecycleState.CANDIDATE_GENERATED);
        lifecycle.transitionTo(TagLifecycleState.REJECTED);
        lifecycle.transitionTo(TagLifecycleState.SCORED);
        lifecycle.transitionTo(TagLifecycleState.SUPPRESSED);

        assertThat(lifecycle.getState()).isEqualTo(TagLifecycleState.SUPPRESSED);
    }

    @Test
    @DisplayName("Should reject skipping a stage")
    void shouldRejectSkippingStage() {
        TagLifecycle lifecycle = new TagLifecycle("T1");

        assertThatThrownBy(() -> lifecycle.transitionTo(TagLifecycleState.SCORED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("UNSCORED -> SCORED");
    }

    @Test
    @DisplayName("Should treat terminal states as final")
    void shouldRejectLeavingTerminalState() {
        TagLifecycle lifecycle = new TagLifecycle("T1");
        lifecycle.transitionTo(TagLifecycleState.CANDIDATE_GENERATED);
        lifecycle.transitionTo(TagLifecycleState.VERIFIED);
        lifecycle.transitionTo(TagLifecycleState.SCORED);
        lifecycle.transitionTo(TagLifecycleState.SUPPRESSED);

        assertThatThrownBy(() -> lifecycle.transitionTo(TagLifecycleState.ACTIONABLE))
                .isInstanceOf(IllegalStateException.class);
    }
}
