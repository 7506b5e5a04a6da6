package com.turbosentinel.core.error;

/**
 * The storage collaborator failed to deliver series data. Aborts the scan of
 * the affected unit only.
 *
 * @since 1.0.0
 */
public class UpstreamDataException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public UpstreamDataException(String message) {
        super(message);
    }

    public UpstreamDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
