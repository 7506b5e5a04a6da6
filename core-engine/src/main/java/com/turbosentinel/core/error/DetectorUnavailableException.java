package com.turbosentinel.core.error;

import com.turbosentinel.core.model.DetectorKind;

import java.util.Objects;

/**
 * A detector could not execute. The detector is skipped and noted; its
 * absence never counts as a rejection.
 *
 * @since 1.0.0
 */
public class DetectorUnavailableException extends DetectionException {

    private static final long serialVersionUID = 1L;

    private final DetectorKind detector;

    public DetectorUnavailableException(DetectorKind detector, String message) {
        super(message);
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
    }

    public DetectorUnavailableException(DetectorKind detector, String message, Throwable cause) {
        super(message, cause);
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
    }

    public DetectorKind getDetector() {
        return detector;
    }
}
