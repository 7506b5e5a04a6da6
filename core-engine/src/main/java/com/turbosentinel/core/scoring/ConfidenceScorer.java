package com.turbosentinel.core.scoring;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.Priority;
import com.turbosentinel.core.model.RecencyBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes a tag's confidence score and priority.
 *
 * <h3>Score</h3>
 * <p>
 * The configured {@link ScoringStrategy} produces the raw components. When the
 * unit runs at low speed the clamped score is multiplied by
 * {@code lowSpeedConfidenceFactor}; the final score always lies in
 * {@code [0, 100]}.
 * </p>
 *
 * <h3>Priority</h3>
 * <p>
 * Derived from the recency profile of verified anomalies, see
 * {@link #priorityOf(RecencyBreakdown, double)}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfidenceScorer {

    private static final Logger LOG = LoggerFactory.getLogger(ConfidenceScorer.class);

    static final String LOW_SPEED_COMPONENT = "low_speed_adjustment";

    private final DetectionConfig config;
    private final ScoringStrategy strategy;

    public ConfidenceScorer(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.strategy = switch (config.getConfidenceStrategy()) {
            case ADDITIVE -> new AdditiveStrategy(config);
            case FIXED_BUDGET -> new FixedBudgetStrategy();
        };
    }

    /**
     * @param evidence evidence of one tag
     * @return score, components and priority
     */
    public ConfidenceResult score(EvidenceProfile evidence) {
        Objects.requireNonNull(evidence, "evidence must not be null");
        Map<String, Double> breakdown = new LinkedHashMap<>(strategy.components(evidence));
        double raw = breakdown.values().stream().mapToDouble(Double::doubleValue).sum();
        double score = strategy.clamp(raw);

        if (evidence.getOperatingState() == OperatingState.LOW_SPEED && score > 0) {
            double adjusted = score * config.getLowSpeedConfidenceFactor();
            breakdown.put(LOW_SPEED_COMPONENT, adjusted - score);
            score = adjusted;
        }
        score = Math.max(0.0, Math.min(100.0, score));

        Priority priority = priorityOf(evidence.getRecency(), evidence.getWeightedScore());
        LOG.debug("Confidence {} ({}), priority {}", score, config.getConfidenceStrategy(), priority);
        return new ConfidenceResult(score, breakdown, priority);
    }

    /**
     * <ul>
     * <li>any anomaly in the last 24 h: {@code CRITICAL}</li>
     * <li>more than 5 in the last 7 days or weighted score above 10: {@code HIGH}</li>
     * <li>more than 10 in the last 30 days or weighted score above 5: {@code MEDIUM}</li>
     * <li>otherwise {@code LOW}</li>
     * </ul>
     *
     * @param recency       verified anomalies by age
     * @param weightedScore recency-weighted anomaly count
     * @return priority
     */
    public static Priority priorityOf(RecencyBreakdown recency, double weightedScore) {
        if (recency.getLast24h() > 0) {
            return Priority.CRITICAL;
        }
        if (recency.getLast7d() > 5 || weightedScore > 10) {
            return Priority.HIGH;
        }
        if (recency.getLast30d() > 10 || weightedScore > 5) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }
}
