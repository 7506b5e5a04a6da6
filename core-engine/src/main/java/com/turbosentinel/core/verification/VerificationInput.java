package com.turbosentinel.core.verification;

import com.turbosentinel.core.config.TagLimits;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.SensorSeries;

import java.util.List;
import java.util.Objects;

/**
 * Everything a verifier needs for one tag.
 *
 * @since 1.0.0
 */
public final class VerificationInput {

    private final SensorSeries series;
    private final List<DetectionCandidate> candidates;
    private final TagLimits limits;

    public VerificationInput(SensorSeries series, List<DetectionCandidate> candidates, TagLimits limits) {
        this.series = Objects.requireNonNull(series, "series must not be null");
        this.candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates must not be null"));
        this.limits = limits != null ? limits : TagLimits.none();
    }

    public SensorSeries getSeries() {
        return series;
    }

    public List<DetectionCandidate> getCandidates() {
        return candidates;
    }

    public TagLimits getLimits() {
        return limits;
    }
}
