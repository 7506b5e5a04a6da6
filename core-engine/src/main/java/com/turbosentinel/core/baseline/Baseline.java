package com.turbosentinel.core.baseline;

import java.util.Objects;

/**
 * Per-sample rolling mean and standard deviation of one series.
 *
 * <p>
 * Samples inside the warm-up period have no baseline: {@link #hasBaselineAt}
 * returns {@code false} and both statistics are {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline {

    private final double[] mean;
    private final double[] std;
    private final double seriesMean;
    private final double seriesStd;
    private final int fallbackCount;

    Baseline(double[] mean, double[] std, double seriesMean, double seriesStd, int fallbackCount) {
        this.mean = Objects.requireNonNull(mean, "mean must not be null");
        this.std = Objects.requireNonNull(std, "std must not be null");
        if (mean.length != std.length) {
            throw new IllegalArgumentException("mean and std must have the same length");
        }
        this.seriesMean = seriesMean;
        this.seriesStd = seriesStd;
        this.fallbackCount = fallbackCount;
    }

    public int size() {
        return mean.length;
    }

    public boolean hasBaselineAt(int index) {
        return !Double.isNaN(mean[index]);
    }

    public double meanAt(int index) {
        return mean[index];
    }

    public double stdAt(int index) {
        return std[index];
    }

    /**
     * @param index sample index
     * @param value value to standardise
     * @return {@code (value - mean) / std} at {@code index}, or {@code NaN}
     *         inside the warm-up period
     */
    public double zScore(int index, double value) {
        if (!hasBaselineAt(index)) {
            return Double.NaN;
        }
        return (value - mean[index]) / std[index];
    }

    public double getSeriesMean() {
        return seriesMean;
    }

    /** @return sample standard deviation (n-1) of the whole series */
    public double getSeriesStd() {
        return seriesStd;
    }

    /** @return number of samples whose rolling std was replaced by the series std */
    public int getFallbackCount() {
        return fallbackCount;
    }

    /**
     * @return rolling mean of the last sample, or the series mean when the
     *         last sample has no baseline
     */
    public double latestMean() {
        int last = mean.length - 1;
        return last >= 0 && hasBaselineAt(last) ? mean[last] : seriesMean;
    }
}
