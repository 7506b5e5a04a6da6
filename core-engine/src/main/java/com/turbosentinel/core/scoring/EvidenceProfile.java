package com.turbosentinel.core.scoring;

import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.RecencyBreakdown;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evidence collected for one tag that the confidence score is computed from.
 *
 * @since 1.0.0
 */
public final class EvidenceProfile {

    private final Map<DetectorKind, Integer> detectorCounts;
    private final int candidateCount;
    private final int confirmedCount;
    private final int sampleCount;
    private final int longestRecentRun;
    private final RecencyBreakdown recency;
    private final double weightedScore;
    private final OperatingState operatingState;

    private EvidenceProfile(Builder b) {
        Map<DetectorKind, Integer> counts = new EnumMap<>(DetectorKind.class);
        counts.putAll(b.detectorCounts);
        this.detectorCounts = Collections.unmodifiableMap(counts);
        this.candidateCount = b.candidateCount;
        this.confirmedCount = b.confirmedCount;
        this.sampleCount = b.sampleCount;
        this.longestRecentRun = b.longestRecentRun;
        this.recency = Objects.requireNonNull(b.recency, "recency must not be null");
        this.weightedScore = b.weightedScore;
        this.operatingState = Objects.requireNonNull(b.operatingState, "operatingState must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public int count(DetectorKind kind) {
        return detectorCounts.getOrDefault(kind, 0);
    }

    public boolean fired(DetectorKind kind) {
        return count(kind) > 0;
    }

    public Map<DetectorKind, Integer> getDetectorCounts() {
        return detectorCounts;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getConfirmedCount() {
        return confirmedCount;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getLongestRecentRun() {
        return longestRecentRun;
    }

    public RecencyBreakdown getRecency() {
        return recency;
    }

    public double getWeightedScore() {
        return weightedScore;
    }

    public OperatingState getOperatingState() {
        return operatingState;
    }

    public static final class Builder {
        private final Map<DetectorKind, Integer> detectorCounts = new EnumMap<>(DetectorKind.class);
        private int candidateCount;
        private int confirmedCount;
        private int sampleCount;
        private int longestRecentRun;
        private RecencyBreakdown recency = RecencyBreakdown.empty();
        private double weightedScore;
        private OperatingState operatingState = OperatingState.RUNNING;

        private Builder() {
        }

        public Builder detectorCount(DetectorKind kind, int count) {
            this.detectorCounts.put(kind, count);
            return this;
        }

        public Builder candidateCount(int v) {
            this.candidateCount = v;
            return this;
        }

        public Builder confirmedCount(int v) {
            this.confirmedCount = v;
            return this;
        }

        public Builder sampleCount(int v) {
            this.sampleCount = v;
            return this;
        }

        public Builder longestRecentRun(int v) {
            this.longestRecentRun = v;
            return this;
        }

        public Builder recency(RecencyBreakdown v) {
            this.recency = v;
            return this;
        }

        public Builder weightedScore(double v) {
            this.weightedScore = v;
            return this;
        }

        public Builder operatingState(OperatingState v) {
            this.operatingState = v;
            return this;
        }

        public EvidenceProfile build() {
            return new EvidenceProfile(this);
        }
    }
}
