package com.turbosentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single time-stamped reading of one process-variable tag.
 *
 * <p>
 * Instances are immutable. {@code unit} and {@code plant} are carried for
 * reporting and may be {@code null} when the storage layer does not know them.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tag;
    private final Instant timestamp;
    private final double value;
    private final String unit;
    private final String plant;

    /**
     * @param tag       sensor tag; must not be {@code null}
     * @param timestamp reading time; must not be {@code null}
     * @param value     reading value; must be finite
     * @param unit      equipment unit the tag belongs to, may be {@code null}
     * @param plant     plant the unit belongs to, may be {@code null}
     */
    public SensorSample(String tag, Instant timestamp, double value, String unit, String plant) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite for tag " + tag + " at " + timestamp);
        }
        this.value = value;
        this.unit = unit;
        this.plant = plant;
    }

    /**
     * Convenience factory for samples whose unit and plant are irrelevant.
     *
     * @param tag       sensor tag
     * @param timestamp reading time
     * @param value     reading value
     * @return new sample
     */
    public static SensorSample of(String tag, Instant timestamp, double value) {
        return new SensorSample(tag, timestamp, value, null, null);
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

    public String getUnit() {
        return unit;
    }

    public String getPlant() {
        return plant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SensorSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && tag.equals(that.tag)
                && timestamp.equals(that.timestamp)
                && Objects.equals(unit, that.unit)
                && Objects.equals(plant, that.plant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, timestamp, value, unit, plant);
    }

    @Override
    public String toString() {
        return "SensorSample{" +
                "tag='" + tag + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                '}';
    }
}
