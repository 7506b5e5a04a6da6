package com.turbosentinel.core.model;

/**
 * Per-run lifecycle of a tag analysis. Transitions are enforced by
 * {@link TagLifecycle}.
 *
 * @since 1.0.0
 */
public enum TagLifecycleState {
    UNSCORED,
    CANDIDATE_GENERATED,
    VERIFIED,
    REJECTED,
    SCORED,
    ACTIONABLE,
    SUPPRESSED
}
