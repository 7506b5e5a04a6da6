package com.turbosentinel.core.scoring;

import com.turbosentinel.core.model.DetectorKind;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Each detector that fired for the tag contributes its full budget:
 * statistical 40, reconstruction 30, tau 20, forest 10.
 *
 * @since 1.0.0
 */
public class FixedBudgetStrategy implements ScoringStrategy {

    @Override
    public Map<String, Double> components(EvidenceProfile evidence) {
        Map<String, Double> components = new LinkedHashMap<>();
        for (DetectorKind kind : DetectorKind.values()) {
            if (evidence.fired(kind)) {
                components.put(kind.name().toLowerCase(Locale.ROOT), (double) kind.getBudgetPoints());
            }
        }
        return components;
    }

    @Override
    public double clamp(double rawScore) {
        return Math.max(0.0, Math.min(100.0, rawScore));
    }
}
