package com.turbosentinel.core.error;

/**
 * Malformed engine, unit or tag configuration.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
