package com.turbosentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Availability of an optional detector for one unit analysis.
 *
 * @since 1.0.0
 */
public final class DetectorStatus implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Availability states. */
    public enum Availability {
        ENABLED,
        UNAVAILABLE,
        NOT_CONFIGURED
    }

    private final DetectorKind detector;
    private final Availability availability;
    private final String reason;

    public DetectorStatus(DetectorKind detector, Availability availability, String reason) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.availability = Objects.requireNonNull(availability, "availability must not be null");
        this.reason = reason;
    }

    public static DetectorStatus enabled(DetectorKind detector) {
        return new DetectorStatus(detector, Availability.ENABLED, null);
    }

    public static DetectorStatus unavailable(DetectorKind detector, String reason) {
        return new DetectorStatus(detector, Availability.UNAVAILABLE, reason);
    }

    public static DetectorStatus notConfigured(DetectorKind detector) {
        return new DetectorStatus(detector, Availability.NOT_CONFIGURED, "no feature tags configured");
    }

    public DetectorKind getDetector() {
        return detector;
    }

    public Availability getAvailability() {
        return availability;
    }

    public String getReason() {
        return reason;
    }

    public boolean isEnabled() {
        return availability == Availability.ENABLED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorStatus that))
            return false;
        return detector == that.detector && availability == that.availability
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detector, availability, reason);
    }

    @Override
    public String toString() {
        return detector + ":" + availability + (reason != null ? " (" + reason + ")" : "");
    }
}
