package com.turbosentinel.core.model;

/**
 * Outcome of scanning one unit.
 *
 * @since 1.0.0
 */
public enum ScanStatus {
    COMPLETED,
    UPSTREAM_FAILURE,
    CANCELLED
}
