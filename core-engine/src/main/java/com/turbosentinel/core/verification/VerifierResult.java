package com.turbosentinel.core.verification;

import com.turbosentinel.core.model.DetectorKind;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Confirmations and scores of one verifier, keyed by candidate timestamp.
 *
 * @since 1.0.0
 */
public final class VerifierResult {

    private final DetectorKind detector;
    private final Set<Instant> confirmed;
    private final Map<Instant, Double> scores;

    public VerifierResult(DetectorKind detector, Set<Instant> confirmed, Map<Instant, Double> scores) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.confirmed = Collections.unmodifiableSet(new HashSet<>(confirmed));
        this.scores = Collections.unmodifiableMap(new HashMap<>(scores));
    }

    public DetectorKind getDetector() {
        return detector;
    }

    public boolean isConfirmed(Instant candidateTime) {
        return confirmed.contains(candidateTime);
    }

    public Set<Instant> getConfirmed() {
        return confirmed;
    }

    public Map<Instant, Double> getScores() {
        return scores;
    }
}
