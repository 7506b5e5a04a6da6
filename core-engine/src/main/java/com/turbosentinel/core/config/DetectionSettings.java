package com.turbosentinel.core.config;

import com.turbosentinel.core.error.ConfigurationException;
import com.turbosentinel.core.model.Priority;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mutable YAML mapping of the {@code detection:} section.
 *
 * <p>
 * Every property is optional. Unset properties keep the defaults of
 * {@link DetectionConfig.Builder}. Durations are expressed in the unit named
 * by the property.
 * </p>
 *
 * <pre>
 * detection:
 *   primarySigmaThreshold: 2.5
 *   minConsecutiveRun: 6
 *   confidenceStrategy: fixed_budget
 *   confidenceThresholds:
 *     CRITICAL: 50
 *     LOW: 80
 *   baselineWindowDays: 90
 *   shutdownPolicy: suppress_analysis
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private Double primarySigmaThreshold;
    private Integer minConsecutiveRun;
    private Integer recencyWindowHours;
    private Boolean requireSecondaryPrimaryDetector;
    private String confidenceStrategy;
    private Map<String, Double> confidenceThresholds = new LinkedHashMap<>();

    private Integer baselineWindowDays;
    private Integer baselineMinPeriods;

    private Integer stateWindowMinutes;
    private Double nearZeroThreshold;
    private Double shutdownFraction;
    private Double lowSpeedRatio;
    private Double lowSpeedFloor;
    private Double lowSpeedConfidenceFactor;
    private String shutdownPolicy;

    private Integer tauWindowMinutes;
    private Integer forestTrees;
    private Long forestSeed;
    private Double maxContamination;
    private Long verifierTimeBudgetMillis;

    private Double minFeatureCoverage;
    private Double reconstructionQuantile;

    private Integer staleAfterHours;
    private Integer workerThreads;

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    /**
     * Build the immutable configuration.
     *
     * @return validated configuration
     * @throws ConfigurationException if an enum name is unknown or a value is
     *                                out of range
     */
    public DetectionConfig toDetectionConfig() {
        DetectionConfig.Builder b = DetectionConfig.builder();
        List<String> errors = new ArrayList<>();

        if (primarySigmaThreshold != null)
            b.primarySigmaThreshold(primarySigmaThreshold);
        if (minConsecutiveRun != null)
            b.minConsecutiveRun(minConsecutiveRun);
        if (recencyWindowHours != null)
            b.recencyWindowHours(recencyWindowHours);
        if (requireSecondaryPrimaryDetector != null)
            b.requireSecondaryPrimaryDetector(requireSecondaryPrimaryDetector);
        if (confidenceStrategy != null) {
            try {
                b.confidenceStrategy(ConfidenceStrategy.valueOf(normalise(confidenceStrategy)));
            } catch (IllegalArgumentException e) {
                errors.add("Unknown confidenceStrategy '" + confidenceStrategy
                        + "'. Supported: additive, fixed_budget");
            }
        }
        Map<Priority, Double> thresholds = new EnumMap<>(Priority.class);
        confidenceThresholds.forEach((name, value) -> {
            try {
                thresholds.put(Priority.valueOf(normalise(name)), value);
            } catch (IllegalArgumentException e) {
                errors.add("Unknown priority '" + name + "' in confidenceThresholds");
            }
        });
        b.confidenceThresholds(thresholds);

        if (baselineWindowDays != null)
            b.baselineWindow(Duration.ofDays(baselineWindowDays));
        if (baselineMinPeriods != null)
            b.baselineMinPeriods(baselineMinPeriods);

        if (stateWindowMinutes != null)
            b.stateWindow(Duration.ofMinutes(stateWindowMinutes));
        if (nearZeroThreshold != null)
            b.nearZeroThreshold(nearZeroThreshold);
        if (shutdownFraction != null)
            b.shutdownFraction(shutdownFraction);
        if (lowSpeedRatio != null)
            b.lowSpeedRatio(lowSpeedRatio);
        if (lowSpeedFloor != null)
            b.lowSpeedFloor(lowSpeedFloor);
        if (lowSpeedConfidenceFactor != null)
            b.lowSpeedConfidenceFactor(lowSpeedConfidenceFactor);
        if (shutdownPolicy != null) {
            try {
                b.shutdownPolicy(ShutdownPolicy.valueOf(normalise(shutdownPolicy)));
            } catch (IllegalArgumentException e) {
                errors.add("Unknown shutdownPolicy '" + shutdownPolicy
                        + "'. Supported: suppress_analysis, annotate_only");
            }
        }

        if (tauWindowMinutes != null)
            b.tauWindow(Duration.ofMinutes(tauWindowMinutes));
        if (forestTrees != null)
            b.forestTrees(forestTrees);
        if (forestSeed != null)
            b.forestSeed(forestSeed);
        if (maxContamination != null)
            b.maxContamination(maxContamination);
        if (verifierTimeBudgetMillis != null)
            b.verifierTimeBudget(Duration.ofMillis(verifierTimeBudgetMillis));

        if (minFeatureCoverage != null)
            b.minFeatureCoverage(minFeatureCoverage);
        if (reconstructionQuantile != null)
            b.reconstructionQuantile(reconstructionQuantile);

        if (staleAfterHours != null)
            b.staleAfter(Duration.ofHours(staleAfterHours));
        if (workerThreads != null)
            b.workerThreads(workerThreads);

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid detection settings: " + String.join("; ", errors));
        }
        return b.build();
    }

    private static String normalise(String name) {
        return name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public Double getPrimarySigmaThreshold() {
        return primarySigmaThreshold;
    }

    public void setPrimarySigmaThreshold(Double primarySigmaThreshold) {
        this.primarySigmaThreshold = primarySigmaThreshold;
    }

    public Integer getMinConsecutiveRun() {
        return minConsecutiveRun;
    }

    public void setMinConsecutiveRun(Integer minConsecutiveRun) {
        this.minConsecutiveRun = minConsecutiveRun;
    }

    public Integer getRecencyWindowHours() {
        return recencyWindowHours;
    }

    public void setRecencyWindowHours(Integer recencyWindowHours) {
        this.recencyWindowHours = recencyWindowHours;
    }

    public Boolean getRequireSecondaryPrimaryDetector() {
        return requireSecondaryPrimaryDetector;
    }

    public void setRequireSecondaryPrimaryDetector(Boolean requireSecondaryPrimaryDetector) {
        this.requireSecondaryPrimaryDetector = requireSecondaryPrimaryDetector;
    }

    public String getConfidenceStrategy() {
        return confidenceStrategy;
    }

    public void setConfidenceStrategy(String confidenceStrategy) {
        this.confidenceStrategy = confidenceStrategy;
    }

    public Map<String, Double> getConfidenceThresholds() {
        return confidenceThresholds;
    }

    public void setConfidenceThresholds(Map<String, Double> confidenceThresholds) {
        this.confidenceThresholds = confidenceThresholds != null
                ? new LinkedHashMap<>(confidenceThresholds)
                : new LinkedHashMap<>();
    }

    public Integer getBaselineWindowDays() {
        return baselineWindowDays;
    }

    public void setBaselineWindowDays(Integer baselineWindowDays) {
        this.baselineWindowDays = baselineWindowDays;
    }

    public Integer getBaselineMinPeriods() {
        return baselineMinPeriods;
    }

    public void setBaselineMinPeriods(Integer baselineMinPeriods) {
        this.baselineMinPeriods = baselineMinPeriods;
    }

    public Integer getStateWindowMinutes() {
        return stateWindowMinutes;
    }

    public void setStateWindowMinutes(Integer stateWindowMinutes) {
        this.stateWindowMinutes = stateWindowMinutes;
    }

    public Double getNearZeroThreshold() {
        return nearZeroThreshold;
    }

    public void setNearZeroThreshold(Double nearZeroThreshold) {
        this.nearZeroThreshold = nearZeroThreshold;
    }

    public Double getShutdownFraction() {
        return shutdownFraction;
    }

    public void setShutdownFraction(Double shutdownFraction) {
        this.shutdownFraction = shutdownFraction;
    }

    public Double getLowSpeedRatio() {
        return lowSpeedRatio;
    }

    public void setLowSpeedRatio(Double lowSpeedRatio) {
        this.lowSpeedRatio = lowSpeedRatio;
    }

    public Double getLowSpeedFloor() {
        return lowSpeedFloor;
    }

    public void setLowSpeedFloor(Double lowSpeedFloor) {
        this.lowSpeedFloor = lowSpeedFloor;
    }

    public Double getLowSpeedConfidenceFactor() {
        return lowSpeedConfidenceFactor;
    }

    public void setLowSpeedConfidenceFactor(Double lowSpeedConfidenceFactor) {
        this.lowSpeedConfidenceFactor = lowSpeedConfidenceFactor;
    }

    public String getShutdownPolicy() {
        return shutdownPolicy;
    }

    public void setShutdownPolicy(String shutdownPolicy) {
        this.shutdownPolicy = shutdownPolicy;
    }

    public Integer getTauWindowMinutes() {
        return tauWindowMinutes;
    }

    public void setTauWindowMinutes(Integer tauWindowMinutes) {
        this.tauWindowMinutes = tauWindowMinutes;
    }

    public Integer getForestTrees() {
        return forestTrees;
    }

    public void setForestTrees(Integer forestTrees) {
        this.forestTrees = forestTrees;
    }

    public Long getForestSeed() {
        return forestSeed;
    }

    public void setForestSeed(Long forestSeed) {
        this.forestSeed = forestSeed;
    }

    public Double getMaxContamination() {
        return maxContamination;
    }

    public void setMaxContamination(Double maxContamination) {
        this.maxContamination = maxContamination;
    }

    public Long getVerifierTimeBudgetMillis() {
        return verifierTimeBudgetMillis;
    }

    public void setVerifierTimeBudgetMillis(Long verifierTimeBudgetMillis) {
        this.verifierTimeBudgetMillis = verifierTimeBudgetMillis;
    }

    public Double getMinFeatureCoverage() {
        return minFeatureCoverage;
    }

    public void setMinFeatureCoverage(Double minFeatureCoverage) {
        this.minFeatureCoverage = minFeatureCoverage;
    }

    public Double getReconstructionQuantile() {
        return reconstructionQuantile;
    }

    public void setReconstructionQuantile(Double reconstructionQuantile) {
        this.reconstructionQuantile = reconstructionQuantile;
    }

    public Integer getStaleAfterHours() {
        return staleAfterHours;
    }

    public void setStaleAfterHours(Integer staleAfterHours) {
        this.staleAfterHours = staleAfterHours;
    }

    public Integer getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(Integer workerThreads) {
        this.workerThreads = workerThreads;
    }
}
