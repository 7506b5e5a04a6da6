package com.turbosentinel.scan;

import java.time.Instant;

/**
 * One line of a JSON-lines sample file, e.g.
 * {@code {"unit":"GT-101","tag":"GT101_EGT","timestamp":"2024-06-01T00:00:00Z","value":512.3}}.
 *
 * <p>
 * Mutable bean for Jackson; converted to a
 * {@link com.turbosentinel.core.model.SensorSample} by {@link SampleJsonReader}.
 * </p>
 */
public class SampleRecord {

    private String unit;
    private String plant;
    private String tag;
    private Instant timestamp;
    private Double value;

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public String getPlant() {
        return plant;
    }

    public void setPlant(String plant) {
        this.plant = plant;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }
}
