package com.turbosentinel.core.model;

/**
 * Outcome of analysing one tag.
 *
 * <p>
 * Every status other than {@link #ANALYZED} means the tag was skipped and its
 * counts carry no information. A skipped tag is never reported as "zero
 * anomalies".
 * </p>
 *
 * @since 1.0.0
 */
public enum TagStatus {

    ANALYZED,
    INSUFFICIENT_DATA,
    INSUFFICIENT_VARIABILITY,
    CONFIGURATION_ERROR,
    SUPPRESSED_SHUTDOWN,
    SECONDARY_DETECTOR_REQUIRED,
    CANCELLED,
    FAILED;

    public boolean isSkipped() {
        return this != ANALYZED;
    }
}
