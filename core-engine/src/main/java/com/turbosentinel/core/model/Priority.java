package com.turbosentinel.core.model;

/**
 * Priority of a tag's anomalies, derived from how recent the verified
 * anomalies are.
 *
 * @since 1.0.0
 */
public enum Priority {

    CRITICAL(1000),
    HIGH(100),
    MEDIUM(10),
    LOW(1);

    private final int severityMultiplier;

    Priority(int severityMultiplier) {
        this.severityMultiplier = severityMultiplier;
    }

    /**
     * @return factor applied to the weighted score when ranking tags
     */
    public int getSeverityMultiplier() {
        return severityMultiplier;
    }
}
