package com.turbosentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-tag result of one analysis run.
 *
 * <p>
 * Immutable. Use {@link #builder(String)} to create and {@link #toBuilder()}
 * to derive an updated copy.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code confirmedCount <= candidateCount}</li>
 * <li>{@code confidenceScore} lies in {@code [0, 100]}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TagAnomalySummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tag;
    private final TagStatus status;
    private final TagLifecycleState lifecycleState;
    private final int candidateCount;
    private final int confirmedCount;
    private final double confidenceScore;
    private final Map<String, Double> confidenceBreakdown;
    private final Priority priority;
    private final RecencyBreakdown recencyBreakdown;
    private final double currentValue;
    private final double baselineMean;
    private final double deviationPercentage;
    private final double weightedScore;
    private final int longestRecentRun;
    private final boolean persistenceSatisfied;
    private final Map<DetectorKind, Integer> detectorCounts;
    private final Map<DetectorKind, String> skippedDetectors;
    private final Duration dataAge;
    private final FreshnessLevel freshness;
    private final String message;

    private TagAnomalySummary(Builder b) {
        if (b.confirmedCount > b.candidateCount) {
            throw new IllegalArgumentException("confirmedCount (" + b.confirmedCount
                    + ") must not exceed candidateCount (" + b.candidateCount + ") for tag " + b.tag);
        }
        if (b.confidenceScore < 0.0 || b.confidenceScore > 100.0 || Double.isNaN(b.confidenceScore)) {
            throw new IllegalArgumentException("confidenceScore must be in [0, 100], got " + b.confidenceScore);
        }
        this.tag = b.tag;
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.lifecycleState = Objects.requireNonNull(b.lifecycleState, "lifecycleState must not be null");
        this.candidateCount = b.candidateCount;
        this.confirmedCount = b.confirmedCount;
        this.confidenceScore = b.confidenceScore;
        this.confidenceBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(b.confidenceBreakdown));
        this.priority = Objects.requireNonNull(b.priority, "priority must not be null");
        this.recencyBreakdown = Objects.requireNonNull(b.recencyBreakdown, "recencyBreakdown must not be null");
        this.currentValue = b.currentValue;
        this.baselineMean = b.baselineMean;
        this.deviationPercentage = b.deviationPercentage;
        this.weightedScore = b.weightedScore;
        this.longestRecentRun = b.longestRecentRun;
        this.persistenceSatisfied = b.persistenceSatisfied;
        this.detectorCounts = Collections.unmodifiableMap(new EnumMap<>(b.detectorCounts));
        this.skippedDetectors = Collections.unmodifiableMap(new EnumMap<>(b.skippedDetectors));
        this.dataAge = b.dataAge;
        this.freshness = Objects.requireNonNull(b.freshness, "freshness must not be null");
        this.message = b.message;
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    public Builder toBuilder() {
        Builder b = new Builder(tag);
        b.status = status;
        b.lifecycleState = lifecycleState;
        b.candidateCount = candidateCount;
        b.confirmedCount = confirmedCount;
        b.confidenceScore = confidenceScore;
        b.confidenceBreakdown.putAll(confidenceBreakdown);
        b.priority = priority;
        b.recencyBreakdown = recencyBreakdown;
        b.currentValue = currentValue;
        b.baselineMean = baselineMean;
        b.deviationPercentage = deviationPercentage;
        b.weightedScore = weightedScore;
        b.longestRecentRun = longestRecentRun;
        b.persistenceSatisfied = persistenceSatisfied;
        b.detectorCounts.putAll(detectorCounts);
        b.skippedDetectors.putAll(skippedDetectors);
        b.dataAge = dataAge;
        b.freshness = freshness;
        b.message = message;
        return b;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getTag() {
        return tag;
    }

    public TagStatus getStatus() {
        return status;
    }

    public TagLifecycleState getLifecycleState() {
        return lifecycleState;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getConfirmedCount() {
        return confirmedCount;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    /**
     * @return named score components in the order they were added
     */
    public Map<String, Double> getConfidenceBreakdown() {
        return confidenceBreakdown;
    }

    public Priority getPriority() {
        return priority;
    }

    public RecencyBreakdown getRecencyBreakdown() {
        return recencyBreakdown;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getDeviationPercentage() {
        return deviationPercentage;
    }

    public double getWeightedScore() {
        return weightedScore;
    }

    public int getLongestRecentRun() {
        return longestRecentRun;
    }

    public boolean isPersistenceSatisfied() {
        return persistenceSatisfied;
    }

    public Map<DetectorKind, Integer> getDetectorCounts() {
        return detectorCounts;
    }

    public int detectorCount(DetectorKind kind) {
        return detectorCounts.getOrDefault(kind, 0);
    }

    /**
     * @return detectors that could not run for this tag, with the reason
     */
    public Map<DetectorKind, String> getSkippedDetectors() {
        return skippedDetectors;
    }

    /** @return age of the latest reading, or {@code null} when there is none */
    public Duration getDataAge() {
        return dataAge;
    }

    public FreshnessLevel getFreshness() {
        return freshness;
    }

    public String getMessage() {
        return message;
    }

    /** @return {@code true} when the tag was not analysed in this run */
    public boolean isSkipped() {
        return status.isSkipped();
    }

    // ---------------------------------------------------------------
    // Object
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TagAnomalySummary that))
            return false;
        return candidateCount == that.candidateCount
                && confirmedCount == that.confirmedCount
                && Double.compare(confidenceScore, that.confidenceScore) == 0
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(baselineMean, that.baselineMean) == 0
                && Double.compare(deviationPercentage, that.deviationPercentage) == 0
                && Double.compare(weightedScore, that.weightedScore) == 0
                && longestRecentRun == that.longestRecentRun
                && persistenceSatisfied == that.persistenceSatisfied
                && tag.equals(that.tag)
                && status == that.status
                && lifecycleState == that.lifecycleState
                && confidenceBreakdown.equals(that.confidenceBreakdown)
                && priority == that.priority
                && recencyBreakdown.equals(that.recencyBreakdown)
                && detectorCounts.equals(that.detectorCounts)
                && skippedDetectors.equals(that.skippedDetectors)
                && Objects.equals(dataAge, that.dataAge)
                && freshness == that.freshness
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, status, lifecycleState, candidateCount, confirmedCount,
                confidenceScore, priority, recencyBreakdown, weightedScore);
    }

    @Override
    public String toString() {
        return "TagAnomalySummary{" +
                "tag='" + tag + '\'' +
                ", status=" + status +
                ", lifecycle=" + lifecycleState +
                ", candidates=" + candidateCount +
                ", confirmed=" + confirmedCount +
                ", confidence=" + String.format("%.1f", confidenceScore) +
                ", priority=" + priority +
                ", recency=" + recencyBreakdown +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link TagAnomalySummary}. Defaults describe an
     * analysed tag with no anomalies.
     */
    public static final class Builder {
        private final String tag;
        private TagStatus status = TagStatus.ANALYZED;
        private TagLifecycleState lifecycleState = TagLifecycleState.UNSCORED;
        private int candidateCount;
        private int confirmedCount;
        private double confidenceScore;
        private final Map<String, Double> confidenceBreakdown = new LinkedHashMap<>();
        private Priority priority = Priority.LOW;
        private RecencyBreakdown recencyBreakdown = RecencyBreakdown.empty();
        private double currentValue = Double.NaN;
        private double baselineMean = Double.NaN;
        private double deviationPercentage = Double.NaN;
        private double weightedScore;
        private int longestRecentRun;
        private boolean persistenceSatisfied;
        private final Map<DetectorKind, Integer> detectorCounts = new EnumMap<>(DetectorKind.class);
        private final Map<DetectorKind, String> skippedDetectors = new EnumMap<>(DetectorKind.class);
        private Duration dataAge;
        private FreshnessLevel freshness = FreshnessLevel.NO_DATA;
        private String message;

        private Builder(String tag) {
            this.tag = Objects.requireNonNull(tag, "tag must not be null");
        }

        public Builder status(TagStatus v) {
            this.status = v;
            return this;
        }

        public Builder lifecycleState(TagLifecycleState v) {
            this.lifecycleState = v;
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

        public Builder confidenceScore(double v) {
            this.confidenceScore = v;
            return this;
        }

        public Builder confidenceBreakdown(Map<String, Double> v) {
            this.confidenceBreakdown.clear();
            this.confidenceBreakdown.putAll(v);
            return this;
        }

        public Builder priority(Priority v) {
            this.priority = v;
            return this;
        }

        public Builder recencyBreakdown(RecencyBreakdown v) {
            this.recencyBreakdown = v;
            return this;
        }

        public Builder currentValue(double v) {
            this.currentValue = v;
            return this;
        }

        public Builder baselineMean(double v) {
            this.baselineMean = v;
            return this;
        }

        public Builder deviationPercentage(double v) {
            this.deviationPercentage = v;
            return this;
        }

        public Builder weightedScore(double v) {
            this.weightedScore = v;
            return this;
        }

        public Builder longestRecentRun(int v) {
            this.longestRecentRun = v;
            return this;
        }

        public Builder persistenceSatisfied(boolean v) {
            this.persistenceSatisfied = v;
            return this;
        }

        public Builder detectorCount(DetectorKind kind, int count) {
            this.detectorCounts.put(kind, count);
            return this;
        }

        public Builder skippedDetectors(Map<DetectorKind, String> v) {
            this.skippedDetectors.clear();
            this.skippedDetectors.putAll(v);
            return this;
        }

        public Builder dataAge(Duration v) {
            this.dataAge = v;
            return this;
        }

        public Builder freshness(FreshnessLevel v) {
            this.freshness = v;
            return this;
        }

        public Builder message(String v) {
            this.message = v;
            return this;
        }

        public TagAnomalySummary build() {
            return new TagAnomalySummary(this);
        }
    }
}
