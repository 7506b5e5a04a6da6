package com.turbosentinel.core.detection;

import com.turbosentinel.core.model.DetectionCandidate;

import java.util.List;
import java.util.Objects;

/**
 * Statistical candidates of one tag plus the persistence evidence derived
 * from them.
 *
 * @since 1.0.0
 */
public final class CandidateSet {

    private final List<DetectionCandidate> candidates;
    private final int longestRecentRun;
    private final boolean persistenceSatisfied;

    public CandidateSet(List<DetectionCandidate> candidates, int longestRecentRun, boolean persistenceSatisfied) {
        this.candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates must not be null"));
        this.longestRecentRun = longestRecentRun;
        this.persistenceSatisfied = persistenceSatisfied;
    }

    /** @return every candidate of the series, not only the recent ones */
    public List<DetectionCandidate> getCandidates() {
        return candidates;
    }

    /** @return longest run of consecutive flagged samples inside the recency window */
    public int getLongestRecentRun() {
        return longestRecentRun;
    }

    public boolean isPersistenceSatisfied() {
        return persistenceSatisfied;
    }

    public int size() {
        return candidates.size();
    }
}
