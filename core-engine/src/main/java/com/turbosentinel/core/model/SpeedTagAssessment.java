package com.turbosentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Operating-state evidence from one speed tag over the state window.
 *
 * @since 1.0.0
 */
public final class SpeedTagAssessment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tag;
    private final OperatingState state;
    private final int sampleCount;
    private final double meanSpeed;
    private final double recentMeanSpeed;
    private final double nearZeroFraction;

    public SpeedTagAssessment(String tag, OperatingState state, int sampleCount, double meanSpeed,
            double recentMeanSpeed, double nearZeroFraction) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.sampleCount = sampleCount;
        this.meanSpeed = meanSpeed;
        this.recentMeanSpeed = recentMeanSpeed;
        this.nearZeroFraction = nearZeroFraction;
    }

    public String getTag() {
        return tag;
    }

    public OperatingState getState() {
        return state;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public double getMeanSpeed() {
        return meanSpeed;
    }

    /** @return mean of the last five readings in the window */
    public double getRecentMeanSpeed() {
        return recentMeanSpeed;
    }

    public double getNearZeroFraction() {
        return nearZeroFraction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpeedTagAssessment that))
            return false;
        return sampleCount == that.sampleCount
                && Double.compare(meanSpeed, that.meanSpeed) == 0
                && Double.compare(recentMeanSpeed, that.recentMeanSpeed) == 0
                && Double.compare(nearZeroFraction, that.nearZeroFraction) == 0
                && tag.equals(that.tag)
                && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, state, sampleCount, meanSpeed, recentMeanSpeed, nearZeroFraction);
    }

    @Override
    public String toString() {
        return "SpeedTagAssessment{tag='" + tag + "', state=" + state
                + ", mean=" + String.format("%.1f", meanSpeed)
                + ", nearZero=" + String.format("%.2f", nearZeroFraction) + '}';
    }
}
