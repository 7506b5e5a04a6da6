package com.turbosentinel.core.config;

import com.turbosentinel.core.error.ConfigurationException;
import com.turbosentinel.core.model.Priority;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable tuning parameters of the detection pipeline.
 *
 * <p>
 * One instance is shared by every tag task of a run; nothing in the pipeline
 * mutates it, so scores are a pure function of the data and this object.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} or the {@link Builder}. YAML configuration is
 * mapped onto the builder by {@link DetectionSettings#toDetectionConfig()}.
 * {@link Builder#build()} validates every value and reports all problems at
 * once.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Candidate generation
    // ---------------------------------------------------------------
    private final double primarySigmaThreshold;
    private final int minConsecutiveRun;
    private final int recencyWindowHours;
    private final Duration baselineWindow;
    private final int baselineMinPeriods;

    // ---------------------------------------------------------------
    // Reconstruction detector
    // ---------------------------------------------------------------
    private final boolean requireSecondaryPrimaryDetector;
    private final double minFeatureCoverage;
    private final double reconstructionQuantile;
    private final int reconstructionMinRows;
    private final double reconstructionVarianceRetained;

    // ---------------------------------------------------------------
    // Operating state
    // ---------------------------------------------------------------
    private final Duration stateWindow;
    private final double nearZeroThreshold;
    private final double shutdownFraction;
    private final double lowSpeedRatio;
    private final double lowSpeedFloor;
    private final double lowSpeedConfidenceFactor;
    private final ShutdownPolicy shutdownPolicy;

    // ---------------------------------------------------------------
    // Verification
    // ---------------------------------------------------------------
    private final Duration tauWindow;
    private final int tauMinLocalSamples;
    private final int forestTrees;
    private final long forestSeed;
    private final int forestMinSamples;
    private final double maxContamination;
    private final Duration verifierTimeBudget;

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------
    private final ConfidenceStrategy confidenceStrategy;
    private final Map<Priority, Double> confidenceThresholds;
    private final double candidateRateSaturation;
    private final double weightHalfLifeDays;

    // ---------------------------------------------------------------
    // Misc
    // ---------------------------------------------------------------
    private final Duration staleAfter;
    private final int workerThreads;

    private DetectionConfig(Builder b) {
        this.primarySigmaThreshold = b.primarySigmaThreshold;
        this.minConsecutiveRun = b.minConsecutiveRun;
        this.recencyWindowHours = b.recencyWindowHours;
        this.baselineWindow = b.baselineWindow;
        this.baselineMinPeriods = b.baselineMinPeriods;
        this.requireSecondaryPrimaryDetector = b.requireSecondaryPrimaryDetector;
        this.minFeatureCoverage = b.minFeatureCoverage;
        this.reconstructionQuantile = b.reconstructionQuantile;
        this.reconstructionMinRows = b.reconstructionMinRows;
        this.reconstructionVarianceRetained = b.reconstructionVarianceRetained;
        this.stateWindow = b.stateWindow;
        this.nearZeroThreshold = b.nearZeroThreshold;
        this.shutdownFraction = b.shutdownFraction;
        this.lowSpeedRatio = b.lowSpeedRatio;
        this.lowSpeedFloor = b.lowSpeedFloor;
        this.lowSpeedConfidenceFactor = b.lowSpeedConfidenceFactor;
        this.shutdownPolicy = b.shutdownPolicy;
        this.tauWindow = b.tauWindow;
        this.tauMinLocalSamples = b.tauMinLocalSamples;
        this.forestTrees = b.forestTrees;
        this.forestSeed = b.forestSeed;
        this.forestMinSamples = b.forestMinSamples;
        this.maxContamination = b.maxContamination;
        this.verifierTimeBudget = b.verifierTimeBudget;
        this.confidenceStrategy = b.confidenceStrategy;
        this.confidenceThresholds = Collections.unmodifiableMap(new EnumMap<>(b.confidenceThresholds));
        this.candidateRateSaturation = b.candidateRateSaturation;
        this.weightHalfLifeDays = b.weightHalfLifeDays;
        this.staleAfter = b.staleAfter;
        this.workerThreads = b.workerThreads;
    }

    public static DetectionConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .primarySigmaThreshold(primarySigmaThreshold)
                .minConsecutiveRun(minConsecutiveRun)
                .recencyWindowHours(recencyWindowHours)
                .baselineWindow(baselineWindow)
                .baselineMinPeriods(baselineMinPeriods)
                .requireSecondaryPrimaryDetector(requireSecondaryPrimaryDetector)
                .minFeatureCoverage(minFeatureCoverage)
                .reconstructionQuantile(reconstructionQuantile)
                .reconstructionMinRows(reconstructionMinRows)
                .reconstructionVarianceRetained(reconstructionVarianceRetained)
                .stateWindow(stateWindow)
                .nearZeroThreshold(nearZeroThreshold)
                .shutdownFraction(shutdownFraction)
                .lowSpeedRatio(lowSpeedRatio)
                .lowSpeedFloor(lowSpeedFloor)
                .lowSpeedConfidenceFactor(lowSpeedConfidenceFactor)
                .shutdownPolicy(shutdownPolicy)
                .tauWindow(tauWindow)
                .tauMinLocalSamples(tauMinLocalSamples)
                .forestTrees(forestTrees)
                .forestSeed(forestSeed)
                .forestMinSamples(forestMinSamples)
                .maxContamination(maxContamination)
                .verifierTimeBudget(verifierTimeBudget)
                .confidenceStrategy(confidenceStrategy)
                .confidenceThresholds(confidenceThresholds)
                .candidateRateSaturation(candidateRateSaturation)
                .weightHalfLifeDays(weightHalfLifeDays)
                .staleAfter(staleAfter)
                .workerThreads(workerThreads);
    }

    /**
     * @param priority priority of a tag
     * @return minimum confidence score for an actionable anomaly of that priority
     */
    public double thresholdFor(Priority priority) {
        return confidenceThresholds.get(priority);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getPrimarySigmaThreshold() {
        return primarySigmaThreshold;
    }

    public int getMinConsecutiveRun() {
        return minConsecutiveRun;
    }

    public int getRecencyWindowHours() {
        return recencyWindowHours;
    }

    public Duration getRecencyWindow() {
        return Duration.ofHours(recencyWindowHours);
    }

    public Duration getBaselineWindow() {
        return baselineWindow;
    }

    public int getBaselineMinPeriods() {
        return baselineMinPeriods;
    }

    public boolean isRequireSecondaryPrimaryDetector() {
        return requireSecondaryPrimaryDetector;
    }

    public double getMinFeatureCoverage() {
        return minFeatureCoverage;
    }

    public double getReconstructionQuantile() {
        return reconstructionQuantile;
    }

    public int getReconstructionMinRows() {
        return reconstructionMinRows;
    }

    public double getReconstructionVarianceRetained() {
        return reconstructionVarianceRetained;
    }

    public Duration getStateWindow() {
        return stateWindow;
    }

    public double getNearZeroThreshold() {
        return nearZeroThreshold;
    }

    public double getShutdownFraction() {
        return shutdownFraction;
    }

    public double getLowSpeedRatio() {
        return lowSpeedRatio;
    }

    public double getLowSpeedFloor() {
        return lowSpeedFloor;
    }

    public double getLowSpeedConfidenceFactor() {
        return lowSpeedConfidenceFactor;
    }

    public ShutdownPolicy getShutdownPolicy() {
        return shutdownPolicy;
    }

    public Duration getTauWindow() {
        return tauWindow;
    }

    public int getTauMinLocalSamples() {
        return tauMinLocalSamples;
    }

    public int getForestTrees() {
        return forestTrees;
    }

    public long getForestSeed() {
        return forestSeed;
    }

    public int getForestMinSamples() {
        return forestMinSamples;
    }

    public double getMaxContamination() {
        return maxContamination;
    }

    public Duration getVerifierTimeBudget() {
        return verifierTimeBudget;
    }

    public ConfidenceStrategy getConfidenceStrategy() {
        return confidenceStrategy;
    }

    public Map<Priority, Double> getConfidenceThresholds() {
        return confidenceThresholds;
    }

    public double getCandidateRateSaturation() {
        return candidateRateSaturation;
    }

    public double getWeightHalfLifeDays() {
        return weightHalfLifeDays;
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "sigma=" + primarySigmaThreshold +
                ", minRun=" + minConsecutiveRun +
                ", recencyHours=" + recencyWindowHours +
                ", strategy=" + confidenceStrategy +
                ", thresholds=" + confidenceThresholds +
                ", requireSecondary=" + requireSecondaryPrimaryDetector +
                ", shutdownPolicy=" + shutdownPolicy +
                ", workers=" + workerThreads +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     */
    public static class Builder {
        private double primarySigmaThreshold = 2.5;
        private int minConsecutiveRun = 6;
        private int recencyWindowHours = 24;
        private Duration baselineWindow = Duration.ofDays(90);
        private int baselineMinPeriods = 20;
        private boolean requireSecondaryPrimaryDetector = false;
        private double minFeatureCoverage = 0.8;
        private double reconstructionQuantile = 0.995;
        private int reconstructionMinRows = 50;
        private double reconstructionVarianceRetained = 0.9;
        private Duration stateWindow = Duration.ofHours(2);
        private double nearZeroThreshold = 10.0;
        private double shutdownFraction = 0.8;
        private double lowSpeedRatio = 0.5;
        private double lowSpeedFloor = 50.0;
        private double lowSpeedConfidenceFactor = 1.0 / 1.5;
        private ShutdownPolicy shutdownPolicy = ShutdownPolicy.SUPPRESS_ANALYSIS;
        private Duration tauWindow = Duration.ofHours(1);
        private int tauMinLocalSamples = 10;
        private int forestTrees = 50;
        private long forestSeed = 42L;
        private int forestMinSamples = 30;
        private double maxContamination = 0.1;
        private Duration verifierTimeBudget = Duration.ofSeconds(5);
        private ConfidenceStrategy confidenceStrategy = ConfidenceStrategy.FIXED_BUDGET;
        private final Map<Priority, Double> confidenceThresholds = defaultThresholds();
        private double candidateRateSaturation = 0.01;
        private double weightHalfLifeDays = 7.0;
        private Duration staleAfter = Duration.ofHours(24);
        private int workerThreads = Runtime.getRuntime().availableProcessors();

        private static Map<Priority, Double> defaultThresholds() {
            Map<Priority, Double> thresholds = new EnumMap<>(Priority.class);
            thresholds.put(Priority.CRITICAL, 50.0);
            thresholds.put(Priority.HIGH, 60.0);
            thresholds.put(Priority.MEDIUM, 70.0);
            thresholds.put(Priority.LOW, 80.0);
            return thresholds;
        }

        public Builder primarySigmaThreshold(double v) {
            this.primarySigmaThreshold = v;
            return this;
        }

        public Builder minConsecutiveRun(int v) {
            this.minConsecutiveRun = v;
            return this;
        }

        public Builder recencyWindowHours(int v) {
            this.recencyWindowHours = v;
            return this;
        }

        public Builder baselineWindow(Duration v) {
            this.baselineWindow = v;
            return this;
        }

        public Builder baselineMinPeriods(int v) {
            this.baselineMinPeriods = v;
            return this;
        }

        public Builder requireSecondaryPrimaryDetector(boolean v) {
            this.requireSecondaryPrimaryDetector = v;
            return this;
        }

        public Builder minFeatureCoverage(double v) {
            this.minFeatureCoverage = v;
            return this;
        }

        public Builder reconstructionQuantile(double v) {
            this.reconstructionQuantile = v;
            return this;
        }

        public Builder reconstructionMinRows(int v) {
            this.reconstructionMinRows = v;
            return this;
        }

        public Builder reconstructionVarianceRetained(double v) {
            this.reconstructionVarianceRetained = v;
            return this;
        }

        public Builder stateWindow(Duration v) {
            this.stateWindow = v;
            return this;
        }

        public Builder nearZeroThreshold(double v) {
            this.nearZeroThreshold = v;
            return this;
        }

        public Builder shutdownFraction(double v) {
            this.shutdownFraction = v;
            return this;
        }

        public Builder lowSpeedRatio(double v) {
            this.lowSpeedRatio = v;
            return this;
        }

        public Builder lowSpeedFloor(double v) {
            this.lowSpeedFloor = v;
            return this;
        }

        public Builder lowSpeedConfidenceFactor(double v) {
            this.lowSpeedConfidenceFactor = v;
            return this;
        }

        public Builder shutdownPolicy(ShutdownPolicy v) {
            this.shutdownPolicy = v;
            return this;
        }

        public Builder tauWindow(Duration v) {
            this.tauWindow = v;
            return this;
        }

        public Builder tauMinLocalSamples(int v) {
            this.tauMinLocalSamples = v;
            return this;
        }

        public Builder forestTrees(int v) {
            this.forestTrees = v;
            return this;
        }

        public Builder forestSeed(long v) {
            this.forestSeed = v;
            return this;
        }

        public Builder forestMinSamples(int v) {
            this.forestMinSamples = v;
            return this;
        }

        public Builder maxContamination(double v) {
            this.maxContamination = v;
            return this;
        }

        public Builder verifierTimeBudget(Duration v) {
            this.verifierTimeBudget = v;
            return this;
        }

        public Builder confidenceStrategy(ConfidenceStrategy v) {
            this.confidenceStrategy = v;
            return this;
        }

        /**
         * Overrides the thresholds present in {@code v}; priorities missing
         * from the map keep their current value.
         */
        public Builder confidenceThresholds(Map<Priority, Double> v) {
            this.confidenceThresholds.putAll(v);
            return this;
        }

        public Builder confidenceThreshold(Priority priority, double v) {
            this.confidenceThresholds.put(priority, v);
            return this;
        }

        public Builder candidateRateSaturation(double v) {
            this.candidateRateSaturation = v;
            return this;
        }

        public Builder weightHalfLifeDays(double v) {
            this.weightHalfLifeDays = v;
            return this;
        }

        public Builder staleAfter(Duration v) {
            this.staleAfter = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        /**
         * @return validated configuration
         * @throws ConfigurationException listing every invalid value
         */
        public DetectionConfig build() {
            List<String> errors = new ArrayList<>();

            positive(errors, "primarySigmaThreshold", primarySigmaThreshold);
            if (minConsecutiveRun < 1)
                errors.add("minConsecutiveRun must be >= 1, got " + minConsecutiveRun);
            if (recencyWindowHours < 1)
                errors.add("recencyWindowHours must be >= 1, got " + recencyWindowHours);
            positive(errors, "baselineWindow", baselineWindow);
            if (baselineMinPeriods < 2)
                errors.add("baselineMinPeriods must be >= 2, got " + baselineMinPeriods);
            fraction(errors, "minFeatureCoverage", minFeatureCoverage);
            if (!(reconstructionQuantile > 0.5 && reconstructionQuantile < 1.0))
                errors.add("reconstructionQuantile must be in (0.5, 1), got " + reconstructionQuantile);
            if (reconstructionMinRows < 10)
                errors.add("reconstructionMinRows must be >= 10, got " + reconstructionMinRows);
            fraction(errors, "reconstructionVarianceRetained", reconstructionVarianceRetained);
            positive(errors, "stateWindow", stateWindow);
            if (!(nearZeroThreshold >= 0))
                errors.add("nearZeroThreshold must be >= 0, got " + nearZeroThreshold);
            fraction(errors, "shutdownFraction", shutdownFraction);
            fraction(errors, "lowSpeedRatio", lowSpeedRatio);
            positive(errors, "lowSpeedFloor", lowSpeedFloor);
            fraction(errors, "lowSpeedConfidenceFactor", lowSpeedConfidenceFactor);
            if (shutdownPolicy == null)
                errors.add("shutdownPolicy must not be null");
            positive(errors, "tauWindow", tauWindow);
            if (tauMinLocalSamples < 3)
                errors.add("tauMinLocalSamples must be >= 3, got " + tauMinLocalSamples);
            if (forestTrees < 1)
                errors.add("forestTrees must be >= 1, got " + forestTrees);
            if (forestMinSamples < 10)
                errors.add("forestMinSamples must be >= 10, got " + forestMinSamples);
            fraction(errors, "maxContamination", maxContamination);
            positive(errors, "verifierTimeBudget", verifierTimeBudget);
            if (confidenceStrategy == null)
                errors.add("confidenceStrategy must not be null");
            for (Priority priority : Priority.values()) {
                Double threshold = confidenceThresholds.get(priority);
                if (threshold == null || !(threshold >= 0 && threshold <= 100))
                    errors.add("confidenceThresholds." + priority + " must be in [0, 100], got " + threshold);
            }
            positive(errors, "candidateRateSaturation", candidateRateSaturation);
            positive(errors, "weightHalfLifeDays", weightHalfLifeDays);
            positive(errors, "staleAfter", staleAfter);
            if (workerThreads < 1)
                errors.add("workerThreads must be >= 1, got " + workerThreads);

            if (!errors.isEmpty()) {
                throw new ConfigurationException(
                        "Detection configuration validation failed:\n  - " + String.join("\n  - ", errors));
            }
            return new DetectionConfig(this);
        }

        private static void positive(List<String> errors, String name, double v) {
            if (!(v > 0) || Double.isInfinite(v))
                errors.add(name + " must be > 0, got " + v);
        }

        private static void positive(List<String> errors, String name, Duration v) {
            if (v == null || v.isNegative() || v.isZero())
                errors.add(name + " must be a positive duration, got " + v);
        }

        private static void fraction(List<String> errors, String name, double v) {
            if (!(v > 0 && v <= 1))
                errors.add(name + " must be in (0, 1], got " + v);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionConfig that))
            return false;
        return toComparable().equals(that.toComparable());
    }

    @Override
    public int hashCode() {
        return toComparable().hashCode();
    }

    private List<Object> toComparable() {
        return List.of(primarySigmaThreshold, minConsecutiveRun, recencyWindowHours, baselineWindow,
                baselineMinPeriods, requireSecondaryPrimaryDetector, minFeatureCoverage,
                reconstructionQuantile, reconstructionMinRows, reconstructionVarianceRetained,
                stateWindow, nearZeroThreshold, shutdownFraction, lowSpeedRatio, lowSpeedFloor,
                lowSpeedConfidenceFactor, shutdownPolicy, tauWindow, tauMinLocalSamples, forestTrees,
                forestSeed, forestMinSamples, maxContamination, verifierTimeBudget,
                confidenceStrategy, confidenceThresholds, candidateRateSaturation,
                weightHalfLifeDays, staleAfter, workerThreads);
    }
}
