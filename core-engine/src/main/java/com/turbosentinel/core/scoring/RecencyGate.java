package com.turbosentinel.core.scoring;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.RecencyBreakdown;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.TagStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * Recency bucketing of verified anomalies and the actionability gate.
 *
 * <h3>Actionable</h3>
 * <p>
 * A tag is actionable only when all of these hold:
 * </p>
 * <ol>
 * <li>at least one verified anomaly in the last 24 hours;</li>
 * <li>confidence score at or above the threshold of its priority;</li>
 * <li>a primary and a verification detector both contributed;</li>
 * <li>the tag was analysed and its recent run is persistent.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class RecencyGate {

    private static final Duration DAY = Duration.ofHours(24);
    private static final Duration WEEK = Duration.ofDays(7);
    private static final Duration MONTH = Duration.ofDays(30);
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final DetectionConfig config;

    public RecencyGate(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Bucket anomalies by age. Timestamps after {@code asOf} count as the most
     * recent bucket.
     *
     * @param anomalyTimes timestamps of verified anomalies
     * @param asOf         analysis instant
     * @return disjoint age buckets
     */
    public RecencyBreakdown breakdown(Collection<Instant> anomalyTimes, Instant asOf) {
        int day = 0;
        int week = 0;
        int month = 0;
        int older = 0;
        for (Instant ts : anomalyTimes) {
            Duration age = Duration.between(ts, asOf);
            if (age.compareTo(DAY) <= 0) {
                day++;
            } else if (age.compareTo(WEEK) <= 0) {
                week++;
            } else if (age.compareTo(MONTH) <= 0) {
                month++;
            } else {
                older++;
            }
        }
        return new RecencyBreakdown(day, week, month, older);
    }

    /**
     * Sum of {@code exp(-ln2 * ageDays / halfLife)} over the anomalies.
     *
     * @param anomalyTimes timestamps of verified anomalies
     * @param asOf         analysis instant
     * @return recency-weighted anomaly count
     */
    public double weightedScore(Collection<Instant> anomalyTimes, Instant asOf) {
        double halfLife = config.getWeightHalfLifeDays();
        double sum = 0.0;
        for (Instant ts : anomalyTimes) {
            double ageDays = Math.max(0.0, Duration.between(ts, asOf).toMillis() / MILLIS_PER_DAY);
            sum += Math.exp(-Math.log(2) * ageDays / halfLife);
        }
        return sum;
    }

    /**
     * @param summary tag summary
     * @return {@code true} when the summary passes every actionability check
     */
    public boolean isActionable(TagAnomalySummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        if (summary.getStatus() != TagStatus.ANALYZED) {
            return false;
        }
        if (summary.getRecencyBreakdown().getLast24h() <= 0) {
            return false;
        }
        if (summary.getConfidenceScore() < config.thresholdFor(summary.getPriority())) {
            return false;
        }
        boolean primary = summary.detectorCount(DetectorKind.STATISTICAL) > 0
                || summary.detectorCount(DetectorKind.RECONSTRUCTION) > 0;
        boolean verification = summary.detectorCount(DetectorKind.TAU_TEST) > 0
                || summary.detectorCount(DetectorKind.OUTLIER_FOREST) > 0;
        return primary && verification && summary.isPersistenceSatisfied();
    }
}
