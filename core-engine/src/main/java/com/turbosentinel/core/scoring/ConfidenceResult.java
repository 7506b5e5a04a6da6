package com.turbosentinel.core.scoring;

import com.turbosentinel.core.model.Priority;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Confidence score, its components and the priority of one tag.
 *
 * @since 1.0.0
 */
public final class ConfidenceResult {

    private final double score;
    private final Map<String, Double> breakdown;
    private final Priority priority;

    public ConfidenceResult(double score, Map<String, Double> breakdown, Priority priority) {
        this.score = score;
        this.breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
    }

    public double getScore() {
        return score;
    }

    public Map<String, Double> getBreakdown() {
        return breakdown;
    }

    public Priority getPriority() {
        return priority;
    }
}
