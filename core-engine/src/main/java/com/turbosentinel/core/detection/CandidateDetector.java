package com.turbosentinel.core.detection;

import com.turbosentinel.core.baseline.Baseline;
import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.SensorSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Primary statistical detector: flags samples whose rolling z-score reaches
 * {@code primarySigmaThreshold} in absolute value.
 *
 * <h3>Persistence</h3>
 * <p>
 * The longest run of consecutive flagged samples is measured over the samples
 * inside the recency window {@code (asOf - recencyWindowHours, asOf]}. The tag
 * is persistence-satisfied when that run reaches {@code minConsecutiveRun}.
 * Older candidates are still returned so that scoring sees the whole history.
 * </p>
 *
 * @since 1.0.0
 */
public class CandidateDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CandidateDetector.class);

    private final DetectionConfig config;

    public CandidateDetector(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * @param series   tag series
     * @param baseline baseline estimated for {@code series}
     * @param asOf     analysis instant
     * @return candidates and persistence evidence
     */
    public CandidateSet detect(SensorSeries series, Baseline baseline, Instant asOf) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        if (baseline.size() != series.size()) {
            throw new IllegalArgumentException("Baseline does not belong to series " + series.getTag());
        }

        double threshold = config.getPrimarySigmaThreshold();
        Instant recentFrom = asOf.minus(config.getRecencyWindow());

        List<DetectionCandidate> candidates = new ArrayList<>();
        int run = 0;
        int longestRecentRun = 0;

        for (int i = 0; i < series.size(); i++) {
            double value = series.valueAt(i);
            double z = baseline.zScore(i, value);
            boolean flagged = !Double.isNaN(z) && Math.abs(z) >= threshold;
            if (flagged) {
                candidates.add(new DetectionCandidate(series.getTag(), series.timestampAt(i), value, z,
                        DetectorKind.STATISTICAL, i));
            }

            Instant ts = series.timestampAt(i);
            boolean recent = ts.isAfter(recentFrom) && !ts.isAfter(asOf);
            if (flagged && recent) {
                run++;
                longestRecentRun = Math.max(longestRecentRun, run);
            } else {
                run = 0;
            }
        }

        boolean persistent = longestRecentRun >= config.getMinConsecutiveRun();
        LOG.debug("Tag '{}': {} statistical candidate(s), longest recent run {} (persistent={})",
                series.getTag(), candidates.size(), longestRecentRun, persistent);
        return new CandidateSet(candidates, longestRecentRun, persistent);
    }
}
