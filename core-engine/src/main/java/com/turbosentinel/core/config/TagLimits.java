package com.turbosentinel.core.config;

import com.turbosentinel.core.error.ConfigurationException;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Optional per-tag hard limits and tau-test sigma override.
 *
 * <p>
 * Values are not checked on construction. {@link #validate(String)} is called
 * per tag during analysis so that one malformed entry marks only that tag as
 * misconfigured.
 * </p>
 *
 * @since 1.0.0
 */
public final class TagLimits implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final TagLimits NONE = new TagLimits(null, null, null);

    private final Double lowerLimit;
    private final Double upperLimit;
    private final Double sigmaOverride;

    public TagLimits(Double lowerLimit, Double upperLimit, Double sigmaOverride) {
        this.lowerLimit = lowerLimit;
        this.upperLimit = upperLimit;
        this.sigmaOverride = sigmaOverride;
    }

    public static TagLimits none() {
        return NONE;
    }

    public OptionalDouble getLowerLimit() {
        return lowerLimit == null ? OptionalDouble.empty() : OptionalDouble.of(lowerLimit);
    }

    public OptionalDouble getUpperLimit() {
        return upperLimit == null ? OptionalDouble.empty() : OptionalDouble.of(upperLimit);
    }

    public OptionalDouble getSigmaOverride() {
        return sigmaOverride == null ? OptionalDouble.empty() : OptionalDouble.of(sigmaOverride);
    }

    public boolean hasHardLimits() {
        return lowerLimit != null || upperLimit != null;
    }

    /**
     * @param value reading to check
     * @return {@code true} when {@code value} lies outside a configured hard limit
     */
    public boolean isOutside(double value) {
        return (lowerLimit != null && value < lowerLimit)
                || (upperLimit != null && value > upperLimit);
    }

    /**
     * @param tag tag the limits belong to, used in the error message
     * @throws ConfigurationException if a value is non-finite, the override is
     *                                not positive or the lower limit is not
     *                                below the upper limit
     */
    public void validate(String tag) {
        if (lowerLimit != null && !Double.isFinite(lowerLimit)) {
            throw new ConfigurationException("Tag '" + tag + "': lowerLimit must be finite");
        }
        if (upperLimit != null && !Double.isFinite(upperLimit)) {
            throw new ConfigurationException("Tag '" + tag + "': upperLimit must be finite");
        }
        if (lowerLimit != null && upperLimit != null && lowerLimit >= upperLimit) {
            throw new ConfigurationException("Tag '" + tag + "': lowerLimit (" + lowerLimit
                    + ") must be below upperLimit (" + upperLimit + ")");
        }
        if (sigmaOverride != null && (!Double.isFinite(sigmaOverride) || sigmaOverride <= 0)) {
            throw new ConfigurationException("Tag '" + tag + "': sigmaOverride must be > 0, got " + sigmaOverride);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TagLimits that))
            return false;
        return Objects.equals(lowerLimit, that.lowerLimit)
                && Objects.equals(upperLimit, that.upperLimit)
                && Objects.equals(sigmaOverride, that.sigmaOverride);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerLimit, upperLimit, sigmaOverride);
    }

    @Override
    public String toString() {
        return "TagLimits{lower=" + lowerLimit + ", upper=" + upperLimit + ", sigma=" + sigmaOverride + '}';
    }
}
