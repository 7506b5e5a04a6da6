package com.turbosentinel.core.detection;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.SensorSeries;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MathUnsupportedOperationException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Secondary primary detector: a PCA reconstruction-error model over the
 * unit's feature tags.
 *
 * <h3>Model</h3>
 * <ol>
 * <li>Rows are the timestamps present in every covered feature tag.</li>
 * <li>Columns are standardised; constant columns are dropped.</li>
 * <li>The leading principal components explaining
 * {@code reconstructionVarianceRetained} of the variance are kept, at most
 * {@code d - 1} of them.</li>
 * <li>The squared reconstruction error of every row is compared to the
 * {@code reconstructionQuantile} of all errors; rows above it are
 * anomalous.</li>
 * </ol>
 *
 * <h3>Availability</h3>
 * <p>
 * The model is fitted only when at least two feature tags are covered, the
 * coverage ratio reaches {@code minFeatureCoverage} and enough aligned rows
 * exist. Otherwise the result is {@code UNAVAILABLE} with a reason.
 * </p>
 *
 * @since 1.0.0
 */
public class ReconstructionDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionDetector.class);

    private static final int MIN_FEATURES = 2;

    private final DetectionConfig config;

    public ReconstructionDetector(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Fit the model on the unit's feature tags and score every aligned row.
     *
     * @param profile     unit profile naming the feature tags
     * @param seriesByTag unit series keyed by tag
     * @return anomalous timestamps, or an unavailable/not-configured result
     */
    public ReconstructionResult evaluate(UnitProfile profile, Map<String, SensorSeries> seriesByTag) {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(seriesByTag, "seriesByTag must not be null");

        List<String> configured = profile.getFeatureTags();
        if (configured.isEmpty()) {
            return ReconstructionResult.notConfigured();
        }

        List<SensorSeries> covered = new ArrayList<>();
        for (String tag : configured) {
            SensorSeries series = seriesByTag.get(tag);
            if (series != null && series.size() >= config.getReconstructionMinRows()) {
                covered.add(series);
            }
        }
        double coverage = (double) covered.size() / configured.size();
        if (covered.size() < MIN_FEATURES) {
            return unavailable(profile, "only " + covered.size() + " feature tag(s) with data", coverage);
        }
        if (coverage < config.getMinFeatureCoverage()) {
            return unavailable(profile, String.format("feature coverage %.2f below %.2f", coverage,
                    config.getMinFeatureCoverage()), coverage);
        }

        List<Instant> rows = alignedTimestamps(covered);
        if (rows.size() < config.getReconstructionMinRows()) {
            return unavailable(profile, rows.size() + " aligned row(s), at least "
                    + config.getReconstructionMinRows() + " required", coverage);
        }

        double[][] data = standardisedMatrix(covered, rows);
        if (data[0].length < MIN_FEATURES) {
            return unavailable(profile, "fewer than two non-constant feature tags", coverage);
        }

        double[] errors;
        try {
            errors = reconstructionErrors(data);
        } catch (MathIllegalArgumentException | MathIllegalStateException
                | MathArithmeticException | MathUnsupportedOperationException e) {
            LOG.warn("Unit {}: reconstruction model could not be fitted", profile.getUnit(), e);
            return ReconstructionResult.unavailable("model fit failed: " + e.getMessage(), coverage);
        }

        double threshold = new Percentile().evaluate(errors, config.getReconstructionQuantile() * 100.0);
        Set<Instant> anomalies = new HashSet<>();
        for (int i = 0; i < errors.length; i++) {
            if (errors[i] > threshold) {
                anomalies.add(rows.get(i));
            }
        }
        LOG.debug("Unit {}: reconstruction flagged {} of {} row(s), threshold {}",
                profile.getUnit(), anomalies.size(), rows.size(), threshold);
        return ReconstructionResult.enabled(anomalies, coverage, threshold);
    }

    /**
     * The tag's own samples at the anomalous timestamps, excluding samples
     * that are already statistical candidates.
     *
     * @param series      tag series
     * @param result      unit reconstruction result
     * @param statistical statistical candidates of the tag
     * @param zScores     z-score per sample index, {@code NaN} where unknown
     * @return reconstruction candidates in time order
     */
    public List<DetectionCandidate> candidatesFor(SensorSeries series, ReconstructionResult result,
            List<DetectionCandidate> statistical, double[] zScores) {
        if (!result.isEnabled() || result.getAnomalyTimes().isEmpty()) {
            return List.of();
        }
        Set<Instant> taken = new HashSet<>();
        for (DetectionCandidate c : statistical) {
            taken.add(c.getTimestamp());
        }
        List<DetectionCandidate> out = new ArrayList<>();
        for (Instant ts : result.getAnomalyTimes()) {
            if (taken.contains(ts)) {
                continue;
            }
            int idx = series.indexAtOrAfter(ts);
            if (idx < series.size() && series.timestampAt(idx).equals(ts)) {
                double z = zScores[idx];
                out.add(new DetectionCandidate(series.getTag(), ts, series.valueAt(idx),
                        Double.isNaN(z) ? 0.0 : z, DetectorKind.RECONSTRUCTION, idx));
            }
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ReconstructionResult unavailable(UnitProfile profile, String reason, double coverage) {
        LOG.warn("Unit {}: reconstruction detector unavailable, {}", profile.getUnit(), reason);
        return ReconstructionResult.unavailable(reason, coverage);
    }

    private static List<Instant> alignedTimestamps(List<SensorSeries> covered) {
        Set<Instant> common = null;
        for (SensorSeries series : covered) {
            Set<Instant> stamps = new HashSet<>(series.size() * 2);
            series.getSamples().forEach(s -> stamps.add(s.getTimestamp()));
            if (common == null) {
                common = stamps;
            } else {
                common.retainAll(stamps);
            }
        }
        List<Instant> rows = new ArrayList<>(common);
        rows.sort(Comparator.naturalOrder());
        return rows;
    }

    private static double[][] standardisedMatrix(List<SensorSeries> covered, List<Instant> rows) {
        List<double[]> columns = new ArrayList<>();
        for (SensorSeries series : covered) {
            Map<Instant, Double> byTime = new HashMap<>(series.size() * 2);
            series.getSamples().forEach(s -> byTime.put(s.getTimestamp(), s.getValue()));
            double[] column = new double[rows.size()];
            for (int i = 0; i < column.length; i++) {
                column[i] = byTime.get(rows.get(i));
            }
            double mean = 0.0;
            for (double v : column) {
                mean += v;
            }
            mean /= column.length;
            double sq = 0.0;
            for (double v : column) {
                sq += (v - mean) * (v - mean);
            }
            double std = Math.sqrt(sq / (column.length - 1));
            if (!(std > 0)) {
                continue;
            }
            for (int i = 0; i < column.length; i++) {
                column[i] = (column[i] - mean) / std;
            }
            columns.add(column);
        }

        double[][] data = new double[rows.size()][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] column = columns.get(j);
            for (int i = 0; i < column.length; i++) {
                data[i][j] = column[i];
            }
        }
        return data;
    }

    private double[] reconstructionErrors(double[][] data) {
        int d = data[0].length;
        RealMatrix covariance = new Covariance(data).getCovarianceMatrix();
        EigenDecomposition eigen = new EigenDecomposition(covariance);
        double[] eigenvalues = eigen.getRealEigenvalues();

        int[] order = IntStream.range(0, d)
                .boxed()
                .sorted((a, b) -> Double.compare(eigenvalues[b], eigenvalues[a]))
                .mapToInt(Integer::intValue)
                .toArray();

        double total = 0.0;
        for (double ev : eigenvalues) {
            total += Math.max(ev, 0.0);
        }
        int k = 0;
        double explained = 0.0;
        while (k < d - 1 && (k == 0 || explained / total < config.getReconstructionVarianceRetained())) {
            explained += Math.max(eigenvalues[order[k]], 0.0);
            k++;
        }

        double[][] components = new double[k][];
        for (int c = 0; c < k; c++) {
            RealVector v = eigen.getEigenvector(order[c]);
            components[c] = v.unitVector().toArray();
        }

        double[] errors = new double[data.length];
        double[] reconstruction = new double[d];
        for (int i = 0; i < data.length; i++) {
            double[] x = data[i];
            Arrays.fill(reconstruction, 0.0);
            for (double[] v : components) {
                double projection = 0.0;
                for (int j = 0; j < d; j++) {
                    projection += x[j] * v[j];
                }
                for (int j = 0; j < d; j++) {
                    reconstruction[j] += projection * v[j];
                }
            }
            double err = 0.0;
            for (int j = 0; j < d; j++) {
                double r = x[j] - reconstruction[j];
                err += r * r;
            }
            errors[i] = err;
        }
        return errors;
    }
}
