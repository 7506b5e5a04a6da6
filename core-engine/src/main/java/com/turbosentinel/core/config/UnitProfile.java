package com.turbosentinel.core.config;

import com.turbosentinel.core.error.ConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Per-unit configuration: which tags carry shaft speed, which tags form the
 * reconstruction feature vector, which tags to analyse and the per-tag limits.
 *
 * <p>
 * Speed tags are always configured explicitly. Tag names are never
 * interpreted.
 * </p>
 *
 * @since 1.0.0
 */
public final class UnitProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String unit;
    private final String plant;
    private final List<String> speedTags;
    private final Double nominalSpeed;
    private final List<String> featureTags;
    private final List<String> monitoredTags;
    private final Map<String, TagLimits> tagLimits;

    private UnitProfile(Builder b) {
        this.unit = b.unit;
        this.plant = b.plant;
        this.speedTags = List.copyOf(b.speedTags);
        this.nominalSpeed = b.nominalSpeed;
        this.featureTags = List.copyOf(b.featureTags);
        this.monitoredTags = List.copyOf(b.monitoredTags);
        this.tagLimits = Collections.unmodifiableMap(new LinkedHashMap<>(b.tagLimits));
    }

    public static Builder builder(String unit) {
        return new Builder(unit);
    }

    public String getUnit() {
        return unit;
    }

    public String getPlant() {
        return plant;
    }

    public List<String> getSpeedTags() {
        return speedTags;
    }

    public OptionalDouble getNominalSpeed() {
        return nominalSpeed == null ? OptionalDouble.empty() : OptionalDouble.of(nominalSpeed);
    }

    public List<String> getFeatureTags() {
        return featureTags;
    }

    /**
     * @return tags to analyse; empty means every tag the storage layer knows
     *         for this unit
     */
    public List<String> getMonitoredTags() {
        return monitoredTags;
    }

    public Map<String, TagLimits> getTagLimits() {
        return tagLimits;
    }

    public Optional<TagLimits> limitsFor(String tag) {
        return Optional.ofNullable(tagLimits.get(tag));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof UnitProfile that))
            return false;
        return unit.equals(that.unit) && Objects.equals(plant, that.plant)
                && speedTags.equals(that.speedTags) && Objects.equals(nominalSpeed, that.nominalSpeed)
                && featureTags.equals(that.featureTags) && monitoredTags.equals(that.monitoredTags)
                && tagLimits.equals(that.tagLimits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, plant, speedTags, nominalSpeed, featureTags, monitoredTags, tagLimits);
    }

    @Override
    public String toString() {
        return "UnitProfile{unit='" + unit + "', speedTags=" + speedTags
                + ", featureTags=" + featureTags + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link UnitProfile}. {@link #build()} rejects a blank unit
     * name, blank or duplicate speed tags and a non-positive nominal speed.
     */
    public static final class Builder {
        private final String unit;
        private String plant;
        private final List<String> speedTags = new ArrayList<>();
        private Double nominalSpeed;
        private final List<String> featureTags = new ArrayList<>();
        private final List<String> monitoredTags = new ArrayList<>();
        private final Map<String, TagLimits> tagLimits = new LinkedHashMap<>();

        private Builder(String unit) {
            this.unit = unit;
        }

        public Builder plant(String v) {
            this.plant = v;
            return this;
        }

        public Builder speedTags(List<String> v) {
            this.speedTags.clear();
            this.speedTags.addAll(v);
            return this;
        }

        public Builder nominalSpeed(Double v) {
            this.nominalSpeed = v;
            return this;
        }

        public Builder featureTags(List<String> v) {
            this.featureTags.clear();
            this.featureTags.addAll(v);
            return this;
        }

        public Builder monitoredTags(List<String> v) {
            this.monitoredTags.clear();
            this.monitoredTags.addAll(v);
            return this;
        }

        public Builder tagLimits(String tag, TagLimits limits) {
            this.tagLimits.put(Objects.requireNonNull(tag, "tag must not be null"),
                    Objects.requireNonNull(limits, "limits must not be null"));
            return this;
        }

        public UnitProfile build() {
            if (unit == null || unit.isBlank()) {
                throw new ConfigurationException("Unit name must not be blank");
            }
            Set<String> seen = new HashSet<>();
            for (String tag : speedTags) {
                if (tag == null || tag.isBlank()) {
                    throw new ConfigurationException("Unit '" + unit + "': speed tag must not be blank");
                }
                if (!seen.add(tag)) {
                    throw new ConfigurationException("Unit '" + unit + "': duplicate speed tag '" + tag + "'");
                }
            }
            for (String tag : featureTags) {
                if (tag == null || tag.isBlank()) {
                    throw new ConfigurationException("Unit '" + unit + "': feature tag must not be blank");
                }
            }
            if (nominalSpeed != null && (!Double.isFinite(nominalSpeed) || nominalSpeed <= 0)) {
                throw new ConfigurationException(
                        "Unit '" + unit + "': nominalSpeed must be > 0, got " + nominalSpeed);
            }
            return new UnitProfile(this);
        }
    }
}
