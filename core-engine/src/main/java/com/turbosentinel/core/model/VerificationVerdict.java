package com.turbosentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of running every available verifier against one candidate.
 *
 * <p>
 * The candidate is verified when at least one verifier confirmed it. A
 * verifier that did not run appears in neither {@code confirmedBy} nor
 * {@code scores}.
 * </p>
 *
 * @since 1.0.0
 */
public final class VerificationVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DetectionCandidate candidate;
    private final Set<DetectorKind> confirmedBy;
    private final Map<DetectorKind, Double> scores;

    public VerificationVerdict(DetectionCandidate candidate, Set<DetectorKind> confirmedBy,
            Map<DetectorKind, Double> scores) {
        this.candidate = Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(confirmedBy, "confirmedBy must not be null");
        Objects.requireNonNull(scores, "scores must not be null");

        EnumSet<DetectorKind> confirmed = EnumSet.noneOf(DetectorKind.class);
        for (DetectorKind kind : confirmedBy) {
            if (!kind.isVerification()) {
                throw new IllegalArgumentException(kind + " is not a verification detector");
            }
            confirmed.add(kind);
        }
        this.confirmedBy = Collections.unmodifiableSet(confirmed);
        this.scores = scores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(scores));
    }

    public DetectionCandidate getCandidate() {
        return candidate;
    }

    public Set<DetectorKind> getConfirmedBy() {
        return confirmedBy;
    }

    public Map<DetectorKind, Double> getScores() {
        return scores;
    }

    public boolean isVerified() {
        return !confirmedBy.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof VerificationVerdict that))
            return false;
        return candidate.equals(that.candidate)
                && confirmedBy.equals(that.confirmedBy)
                && scores.equals(that.scores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, confirmedBy, scores);
    }

    @Override
    public String toString() {
        return "VerificationVerdict{candidate=" + candidate.getTimestamp()
                + ", confirmedBy=" + confirmedBy + '}';
    }
}
