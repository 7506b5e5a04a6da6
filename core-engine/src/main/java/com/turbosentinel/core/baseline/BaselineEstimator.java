package com.turbosentinel.core.baseline;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.error.InsufficientDataException;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.TagStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes a time-based rolling baseline for a tag.
 *
 * <h3>Algorithm</h3>
 * <p>
 * For sample {@code i} the window holds every sample with a timestamp in
 * {@code (t_i - window, t_i]}, so the current sample is included. Two indices
 * sweep the series once and maintain running sums of the values shifted by
 * the first value, which keeps the variance numerically stable.
 * </p>
 * <ul>
 * <li>Fewer than {@code baselineMinPeriods} samples in the window: no
 * baseline for that sample.</li>
 * <li>A window std that is zero or not finite is replaced by the series-wide
 * sample std.</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless apart from the immutable configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineEstimator.class);

    /** Relative variance below which a series counts as constant. */
    private static final double DEGENERATE_RELATIVE_STD = 1e-9;

    private final Duration window;
    private final int minPeriods;

    public BaselineEstimator(DetectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.window = config.getBaselineWindow();
        this.minPeriods = config.getBaselineMinPeriods();
    }

    /**
     * @param series tag series
     * @return per-sample baseline
     * @throws InsufficientDataException with status {@code INSUFFICIENT_DATA}
     *                                   when the series is shorter than the
     *                                   minimum periods, or
     *                                   {@code INSUFFICIENT_VARIABILITY} when
     *                                   the series std is degenerate
     */
    public Baseline estimate(SensorSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n < minPeriods) {
            throw new InsufficientDataException(TagStatus.INSUFFICIENT_DATA,
                    "Tag '" + series.getTag() + "' has " + n + " samples, at least " + minPeriods + " required");
        }

        double[] values = series.values();
        double seriesMean = mean(values);
        double seriesStd = sampleStd(values, seriesMean);
        if (isDegenerate(seriesStd, seriesMean)) {
            throw new InsufficientDataException(TagStatus.INSUFFICIENT_VARIABILITY,
                    "Tag '" + series.getTag() + "' has no usable variability (std=" + seriesStd + ")");
        }

        double[] mean = new double[n];
        double[] std = new double[n];
        double shift = values[0];
        double sum = 0.0;
        double sumSq = 0.0;
        int start = 0;
        int fallbacks = 0;
        long windowMillis = window.toMillis();

        for (int i = 0; i < n; i++) {
            double v = values[i] - shift;
            sum += v;
            sumSq += v * v;

            long lowerExclusive = series.timestampAt(i).toEpochMilli() - windowMillis;
            while (series.timestampAt(start).toEpochMilli() <= lowerExclusive) {
                double old = values[start] - shift;
                sum -= old;
                sumSq -= old * old;
                start++;
            }

            int count = i - start + 1;
            if (count < minPeriods) {
                mean[i] = Double.NaN;
                std[i] = Double.NaN;
                continue;
            }
            double m = sum / count;
            double variance = (sumSq - sum * m) / (count - 1);
            double s = variance > 0 ? Math.sqrt(variance) : 0.0;
            mean[i] = m + shift;
            if (!Double.isFinite(s) || isDegenerate(s, mean[i])) {
                std[i] = seriesStd;
                fallbacks++;
            } else {
                std[i] = s;
            }
        }

        if (fallbacks > 0) {
            LOG.debug("Tag '{}': {} sample(s) used the series-wide std fallback", series.getTag(), fallbacks);
        }
        return new Baseline(mean, std, seriesMean, seriesStd, fallbacks);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double sampleStd(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double sq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    private static boolean isDegenerate(double std, double mean) {
        return !(std > DEGENERATE_RELATIVE_STD * Math.max(1.0, Math.abs(mean)));
    }
}
