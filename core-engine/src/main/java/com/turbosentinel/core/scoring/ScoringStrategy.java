package com.turbosentinel.core.scoring;

import java.util.Map;

/**
 * Turns a tag's evidence into named confidence components. The raw score is
 * the sum of the components.
 */
public interface ScoringStrategy {

    /**
     * @param evidence evidence of one tag
     * @return components in presentation order; empty when there is nothing
     *         to score
     */
    Map<String, Double> components(EvidenceProfile evidence);

    /**
     * @param rawScore sum of the components
     * @return the score clamped to the strategy's range
     */
    double clamp(double rawScore);
}
