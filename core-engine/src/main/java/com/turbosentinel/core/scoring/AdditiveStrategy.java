package com.turbosentinel.core.scoring;

import com.turbosentinel.core.config.DetectionConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base points plus three saturating components:
 *
 * <pre>
 * 20
 *  + 35 * min(1, recentVerified / minConsecutiveRun)
 *  + 30 * min(1, longestRecentRun / minConsecutiveRun)
 *  + 15 * min(1, candidateRate / candidateRateSaturation)
 * </pre>
 *
 * <p>
 * clamped to {@code [20, 100]}. Without a verified anomaly the score is zero.
 * </p>
 *
 * @since 1.0.0
 */
public class AdditiveStrategy implements ScoringStrategy {

    static final double BASE = 20.0;
    static final double RECENCY_WEIGHT = 35.0;
    static final double PERSISTENCE_WEIGHT = 30.0;
    static final double RATE_WEIGHT = 15.0;

    private final DetectionConfig config;

    public AdditiveStrategy(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public Map<String, Double> components(EvidenceProfile evidence) {
        Map<String, Double> components = new LinkedHashMap<>();
        if (evidence.getConfirmedCount() == 0) {
            return components;
        }
        double minRun = config.getMinConsecutiveRun();
        double candidateRate = evidence.getSampleCount() > 0
                ? (double) evidence.getCandidateCount() / evidence.getSampleCount()
                : 0.0;

        components.put("base", BASE);
        components.put("recency", RECENCY_WEIGHT * Math.min(1.0, evidence.getRecency().getLast24h() / minRun));
        components.put("persistence", PERSISTENCE_WEIGHT * Math.min(1.0, evidence.getLongestRecentRun() / minRun));
        components.put("candidate_rate",
                RATE_WEIGHT * Math.min(1.0, candidateRate / config.getCandidateRateSaturation()));
        return components;
    }

    @Override
    public double clamp(double rawScore) {
        if (rawScore == 0.0) {
            return 0.0;
        }
        return Math.max(BASE, Math.min(100.0, rawScore));
    }
}
