package com.turbosentinel.core.engine;

import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.detection.ReconstructionResult;
import com.turbosentinel.core.model.StateAssessment;

import java.time.Instant;
import java.util.Objects;

/**
 * Unit-level facts shared by every tag task of one analysis run.
 */
final class UnitContext {

    private final UnitProfile profile;
    private final Instant asOf;
    private final StateAssessment state;
    private final ReconstructionResult reconstruction;
    private final boolean analysisSuppressed;

    UnitContext(UnitProfile profile, Instant asOf, StateAssessment state, ReconstructionResult reconstruction,
            boolean analysisSuppressed) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.asOf = Objects.requireNonNull(asOf, "asOf must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.reconstruction = reconstruction;
        this.analysisSuppressed = analysisSuppressed;
    }

    UnitProfile profile() {
        return profile;
    }

    Instant asOf() {
        return asOf;
    }

    StateAssessment state() {
        return state;
    }

    /** @return reconstruction result, {@code null} when analysis is suppressed */
    ReconstructionResult reconstruction() {
        return reconstruction;
    }

    boolean analysisSuppressed() {
        return analysisSuppressed;
    }
}
