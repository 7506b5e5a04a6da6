package com.turbosentinel.core.verification;

import com.amazon.randomcutforest.RandomCutForest;
import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.error.DetectorUnavailableException;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.SensorSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Isolation-style verifier built on a Random Cut Forest.
 *
 * <h3>Features</h3>
 * <p>
 * Each sample is described by its value, the previous value, the first
 * difference and the mean and standard deviation of the last five values.
 * Every feature is standardised over the series.
 * </p>
 *
 * <h3>Decision</h3>
 * <p>
 * A fresh forest (fixed seed, no time decay) is fed every sample and then
 * scores every sample. The top {@code min(maxContamination, candidates / n)}
 * fraction is flagged, and a candidate is confirmed when its nearest sample
 * is flagged. Series shorter than {@code forestMinSamples} make the verifier
 * unavailable.
 * </p>
 *
 * @since 1.0.0
 */
public class OutlierForestVerifier implements Verifier {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierForestVerifier.class);

    static final int ROLLING_WINDOW = 5;
    static final int FEATURES = 5;
    static final int MAX_SAMPLE_SIZE = 256;
    private static final int CHECK_EVERY = 256;

    private final DetectionConfig config;

    public OutlierForestVerifier(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.OUTLIER_FOREST;
    }

    @Override
    public VerifierResult verify(VerificationInput input, Deadline deadline) {
        SensorSeries series = input.getSeries();
        int n = series.size();
        if (n < config.getForestMinSamples()) {
            throw new DetectorUnavailableException(kind(), "Tag '" + series.getTag() + "' has " + n
                    + " samples, outlier forest needs " + config.getForestMinSamples());
        }

        double[][] features = features(series.values());
        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(FEATURES)
                .numberOfTrees(config.getForestTrees())
                .sampleSize(Math.min(MAX_SAMPLE_SIZE, n))
                .randomSeed(config.getForestSeed())
                .timeDecay(0.0)
                .parallelExecutionEnabled(false)
                .build();

        for (int i = 0; i < n; i++) {
            if (i % CHECK_EVERY == 0) {
                deadline.check();
            }
            forest.update(features[i]);
        }
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            if (i % CHECK_EVERY == 0) {
                deadline.check();
            }
            scores[i] = forest.getAnomalyScore(features[i]);
        }

        double contamination = Math.min(config.getMaxContamination(),
                (double) input.getCandidates().size() / n);
        int flaggedCount = Math.max(1, (int) Math.round(contamination * n));
        boolean[] flagged = topScores(scores, flaggedCount);

        Set<Instant> confirmed = new HashSet<>();
        Map<Instant, Double> candidateScores = new HashMap<>();
        for (DetectionCandidate candidate : input.getCandidates()) {
            int idx = series.nearestIndex(candidate.getTimestamp());
            candidateScores.put(candidate.getTimestamp(), scores[idx]);
            if (flagged[idx]) {
                confirmed.add(candidate.getTimestamp());
            }
        }

        LOG.debug("Tag '{}': outlier forest flagged {} sample(s), confirmed {} of {} candidate(s)",
                series.getTag(), flaggedCount, confirmed.size(), input.getCandidates().size());
        return new VerifierResult(kind(), confirmed, candidateScores);
    }

    // ---------------------------------------------------------------
    // Feature engineering
    // ---------------------------------------------------------------

    /**
     * @param values series values
     * @return standardised feature rows: value, lag-1, diff, rolling mean,
     *         rolling std
     */
    static double[][] features(double[] values) {
        int n = values.length;
        double[][] rows = new double[n][FEATURES];
        for (int i = 0; i < n; i++) {
            double lag = i > 0 ? values[i - 1] : values[i];
            int from = Math.max(0, i - ROLLING_WINDOW + 1);
            int count = i - from + 1;
            double sum = 0.0;
            for (int j = from; j <= i; j++) {
                sum += values[j];
            }
            double mean = sum / count;
            double sq = 0.0;
            for (int j = from; j <= i; j++) {
                sq += (values[j] - mean) * (values[j] - mean);
            }
            rows[i][0] = values[i];
            rows[i][1] = lag;
            rows[i][2] = values[i] - lag;
            rows[i][3] = mean;
            rows[i][4] = count > 1 ? Math.sqrt(sq / (count - 1)) : 0.0;
        }
        standardise(rows);
        return rows;
    }

    private static void standardise(double[][] rows) {
        int n = rows.length;
        for (int c = 0; c < FEATURES; c++) {
            double sum = 0.0;
            for (double[] row : rows) {
                sum += row[c];
            }
            double mean = sum / n;
            double sq = 0.0;
            for (double[] row : rows) {
                sq += (row[c] - mean) * (row[c] - mean);
            }
            double std = Math.sqrt(sq / n);
            for (double[] row : rows) {
                row[c] = std > 0 ? (row[c] - mean) / std : 0.0;
            }
        }
    }

    private static boolean[] topScores(double[] scores, int count) {
        boolean[] flagged = new boolean[scores.length];
        IntStream.range(0, scores.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> scores[i]).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(count)
                .forEach(i -> flagged[i] = true);
        return flagged;
    }
}
