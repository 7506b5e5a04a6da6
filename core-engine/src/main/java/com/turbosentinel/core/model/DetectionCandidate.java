package com.turbosentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A sample flagged by a primary detector as a potential anomaly.
 *
 * <p>
 * {@code sampleIndex} is the position of the sample inside the analysed
 * {@link SensorSeries}; verifiers use it to locate the sample without a
 * timestamp search.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionCandidate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tag;
    private final Instant timestamp;
    private final double value;
    private final double zScore;
    private final DetectorKind sourceDetector;
    private final int sampleIndex;

    public DetectionCandidate(String tag, Instant timestamp, double value, double zScore,
            DetectorKind sourceDetector, int sampleIndex) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.sourceDetector = Objects.requireNonNull(sourceDetector, "sourceDetector must not be null");
        if (!sourceDetector.isPrimary()) {
            throw new IllegalArgumentException(
                    "Candidates come from primary detectors only, got " + sourceDetector);
        }
        if (sampleIndex < 0) {
            throw new IllegalArgumentException("sampleIndex must be >= 0, got " + sampleIndex);
        }
        this.value = value;
        this.zScore = zScore;
        this.sampleIndex = sampleIndex;
    }

    public String getTag() {
        return tag;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getZScore() {
        return zScore;
    }

    public DetectorKind getSourceDetector() {
        return sourceDetector;
    }

    public int getSampleIndex() {
        return sampleIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionCandidate that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(zScore, that.zScore) == 0
                && sampleIndex == that.sampleIndex
                && tag.equals(that.tag)
                && timestamp.equals(that.timestamp)
                && sourceDetector == that.sourceDetector;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, timestamp, value, zScore, sourceDetector, sampleIndex);
    }

    @Override
    public String toString() {
        return "DetectionCandidate{" +
                "tag='" + tag + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", z=" + String.format("%.2f", zScore) +
                ", source=" + sourceDetector +
                '}';
    }
}
