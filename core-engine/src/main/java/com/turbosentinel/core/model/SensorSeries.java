package com.turbosentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Time-ordered readings of a single tag.
 *
 * <p>
 * The storage collaborator guarantees sorted, de-duplicated data. The
 * constructor still rejects out-of-order or duplicate timestamps so that a
 * contract violation upstream surfaces as an error instead of as silently
 * wrong statistics.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable and safe to share between worker threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tag;
    private final String unit;
    private final List<SensorSample> samples;

    /**
     * @param tag     tag every sample must carry; must not be {@code null}
     * @param unit    owning unit, may be {@code null}
     * @param samples readings in strictly increasing timestamp order
     * @throws IllegalArgumentException if a sample belongs to another tag or the
     *                                  timestamps are not strictly increasing
     */
    public SensorSeries(String tag, String unit, List<SensorSample> samples) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.unit = unit;
        Objects.requireNonNull(samples, "samples must not be null");

        List<SensorSample> copy = new ArrayList<>(samples.size());
        Instant previous = null;
        for (SensorSample sample : samples) {
            Objects.requireNonNull(sample, "samples must not contain null");
            if (!tag.equals(sample.getTag())) {
                throw new IllegalArgumentException(
                        "Sample for tag '" + sample.getTag() + "' in series of tag '" + tag + "'");
            }
            if (previous != null && !sample.getTimestamp().isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Series '" + tag + "' is not strictly increasing at " + sample.getTimestamp());
            }
            previous = sample.getTimestamp();
            copy.add(sample);
        }
        this.samples = Collections.unmodifiableList(copy);
    }

    public static SensorSeries empty(String tag, String unit) {
        return new SensorSeries(tag, unit, List.of());
    }

    public String getTag() {
        return tag;
    }

    public String getUnit() {
        return unit;
    }

    /**
     * @return unmodifiable, time-ordered samples
     */
    public List<SensorSample> getSamples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double valueAt(int index) {
        return samples.get(index).getValue();
    }

    public Instant timestampAt(int index) {
        return samples.get(index).getTimestamp();
    }

    /**
     * @return all values in sample order; a fresh array on every call
     */
    public double[] values() {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getValue();
        }
        return values;
    }

    public Optional<SensorSample> latest() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    }

    /**
     * Index of the first sample at or after {@code instant}, or {@link #size()}
     * when every sample is earlier.
     *
     * @param instant lower bound
     * @return insertion point
     */
    public int indexAtOrAfter(Instant instant) {
        int lo = 0;
        int hi = samples.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (samples.get(mid).getTimestamp().isBefore(instant)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Index of the sample closest in time to {@code instant}.
     *
     * @param instant target time
     * @return nearest index, or {@code -1} for an empty series
     */
    public int nearestIndex(Instant instant) {
        if (samples.isEmpty()) {
            return -1;
        }
        int idx = indexAtOrAfter(instant);
        if (idx == 0) {
            return 0;
        }
        if (idx == samples.size()) {
            return samples.size() - 1;
        }
        long after = samples.get(idx).getTimestamp().toEpochMilli() - instant.toEpochMilli();
        long before = instant.toEpochMilli() - samples.get(idx - 1).getTimestamp().toEpochMilli();
        return before <= after ? idx - 1 : idx;
    }

    /**
     * Samples with {@code from <= timestamp < to}.
     *
     * @param from inclusive lower bound
     * @param to   exclusive upper bound
     * @return a new series restricted to the interval
     */
    public SensorSeries slice(Instant from, Instant to) {
        int start = indexAtOrAfter(from);
        int end = indexAtOrAfter(to);
        return new SensorSeries(tag, unit, samples.subList(start, Math.max(start, end)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SensorSeries that))
            return false;
        return tag.equals(that.tag) && Objects.equals(unit, that.unit) && samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, unit, samples);
    }

    @Override
    public String toString() {
        return "SensorSeries{tag='" + tag + "', unit='" + unit + "', size=" + samples.size() + '}';
    }
}
