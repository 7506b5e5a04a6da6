package com.turbosentinel.core.detection;

import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.DetectorStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of the reconstruction detector for one unit.
 *
 * @since 1.0.0
 */
public final class ReconstructionResult {

    private final DetectorStatus status;
    private final Set<Instant> anomalyTimes;
    private final double featureCoverage;
    private final double errorThreshold;

    private ReconstructionResult(DetectorStatus status, Set<Instant> anomalyTimes, double featureCoverage,
            double errorThreshold) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.anomalyTimes = Collections.unmodifiableSet(new TreeSet<>(anomalyTimes));
        this.featureCoverage = featureCoverage;
        this.errorThreshold = errorThreshold;
    }

    public static ReconstructionResult enabled(Set<Instant> anomalyTimes, double featureCoverage,
            double errorThreshold) {
        return new ReconstructionResult(DetectorStatus.enabled(DetectorKind.RECONSTRUCTION), anomalyTimes,
                featureCoverage, errorThreshold);
    }

    public static ReconstructionResult unavailable(String reason, double featureCoverage) {
        return new ReconstructionResult(DetectorStatus.unavailable(DetectorKind.RECONSTRUCTION, reason),
                Set.of(), featureCoverage, Double.NaN);
    }

    public static ReconstructionResult notConfigured() {
        return new ReconstructionResult(DetectorStatus.notConfigured(DetectorKind.RECONSTRUCTION),
                Set.of(), 0.0, Double.NaN);
    }

    public DetectorStatus getStatus() {
        return status;
    }

    public boolean isEnabled() {
        return status.isEnabled();
    }

    /** @return timestamps whose reconstruction error exceeded the threshold, ascending */
    public Set<Instant> getAnomalyTimes() {
        return anomalyTimes;
    }

    public double getFeatureCoverage() {
        return featureCoverage;
    }

    public double getErrorThreshold() {
        return errorThreshold;
    }
}
