package com.turbosentinel.core.config;

import java.io.Serializable;

/**
 * Mutable YAML mapping of one entry under a unit's {@code limits:} map.
 *
 * @since 1.0.0
 */
public class TagLimitSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private Double lowerLimit;
    private Double upperLimit;
    private Double sigmaOverride;

    public TagLimits toTagLimits() {
        return new TagLimits(lowerLimit, upperLimit, sigmaOverride);
    }

    public Double getLowerLimit() {
        return lowerLimit;
    }

    public void setLowerLimit(Double lowerLimit) {
        this.lowerLimit = lowerLimit;
    }

    public Double getUpperLimit() {
        return upperLimit;
    }

    public void setUpperLimit(Double upperLimit) {
        this.upperLimit = upperLimit;
    }

    public Double getSigmaOverride() {
        return sigmaOverride;
    }

    public void setSigmaOverride(Double sigmaOverride) {
        this.sigmaOverride = sigmaOverride;
    }
}
