package com.turbosentinel.core.verification;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.TagLimits;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.SensorSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Modified Thompson tau test over a local window around each candidate.
 *
 * <h3>Rule</h3>
 * <p>
 * The window holds the samples within {@code tauWindow} on either side of the
 * candidate. When it has fewer than {@code tauMinLocalSamples} samples the
 * whole series is used instead. The candidate is confirmed when
 * {@code |value - mean| > critical * std}, where {@code critical} is
 * {@code 1.15} for {@code n <= 10}, {@code 1.4} for {@code n <= 50} and
 * {@code 1.5} above, unless the tag configures a sigma override. A value
 * outside the tag's hard limits is confirmed regardless.
 * </p>
 * <p>
 * Windows with fewer than three samples or zero spread do not confirm.
 * </p>
 *
 * @since 1.0.0
 */
public class TauVerifier implements Verifier {

    private static final Logger LOG = LoggerFactory.getLogger(TauVerifier.class);

    static final int MIN_WINDOW = 3;

    private final Duration window;
    private final int minLocalSamples;

    public TauVerifier(DetectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.window = config.getTauWindow();
        this.minLocalSamples = config.getTauMinLocalSamples();
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.TAU_TEST;
    }

    @Override
    public VerifierResult verify(VerificationInput input, Deadline deadline) {
        SensorSeries series = input.getSeries();
        TagLimits limits = input.getLimits();
        double[] values = series.values();
        WindowStats full = WindowStats.of(values, 0, values.length);

        Set<Instant> confirmed = new HashSet<>();
        Map<Instant, Double> scores = new HashMap<>();

        for (DetectionCandidate candidate : input.getCandidates()) {
            deadline.check();
            Instant ts = candidate.getTimestamp();
            int from = series.indexAtOrAfter(ts.minus(window));
            int to = series.indexAtOrAfter(ts.plus(window).plusNanos(1));
            WindowStats stats = to - from >= minLocalSamples ? WindowStats.of(values, from, to) : full;

            double critical = limits.getSigmaOverride().orElse(criticalValue(stats.count));
            double deviation = Math.abs(candidate.getValue() - stats.mean);
            boolean usable = stats.count >= MIN_WINDOW && stats.std > 0;
            double score = usable ? deviation / stats.std : 0.0;

            boolean byTau = usable && deviation > critical * stats.std;
            boolean byLimit = limits.isOutside(candidate.getValue());
            scores.put(ts, score);
            if (byTau || byLimit) {
                confirmed.add(ts);
            }
        }

        LOG.debug("Tag '{}': tau test confirmed {} of {} candidate(s)",
                series.getTag(), confirmed.size(), input.getCandidates().size());
        return new VerifierResult(kind(), confirmed, scores);
    }

    /**
     * @param n samples in the test window
     * @return tiered critical value
     */
    static double criticalValue(int n) {
        if (n <= 10) {
            return 1.15;
        }
        if (n <= 50) {
            return 1.4;
        }
        return 1.5;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static final class WindowStats {
        final int count;
        final double mean;
        final double std;

        WindowStats(int count, double mean, double std) {
            this.count = count;
            this.mean = mean;
            this.std = std;
        }

        static WindowStats of(double[] values, int from, int to) {
            int n = to - from;
            if (n <= 0) {
                return new WindowStats(0, Double.NaN, 0.0);
            }
            double sum = 0.0;
            for (int i = from; i < to; i++) {
                sum += values[i];
            }
            double mean = sum / n;
            if (n < 2) {
                return new WindowStats(n, mean, 0.0);
            }
            double sq = 0.0;
            for (int i = from; i < to; i++) {
                double d = values[i] - mean;
                sq += d * d;
            }
            return new WindowStats(n, mean, Math.sqrt(sq / (n - 1)));
        }
    }
}
