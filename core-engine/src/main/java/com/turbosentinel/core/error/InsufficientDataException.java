package com.turbosentinel.core.error;

import com.turbosentinel.core.model.TagStatus;

import java.util.Objects;

/**
 * A tag cannot be analysed because its series is too short or has no usable
 * variability. Carries the status the tag is reported with.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends DetectionException {

    private static final long serialVersionUID = 1L;

    private final TagStatus status;

    public InsufficientDataException(TagStatus status, String message) {
        super(message);
        this.status = Objects.requireNonNull(status, "status must not be null");
        if (status != TagStatus.INSUFFICIENT_DATA && status != TagStatus.INSUFFICIENT_VARIABILITY) {
            throw new IllegalArgumentException("Not an insufficient-data status: " + status);
        }
    }

    public TagStatus getStatus() {
        return status;
    }
}
