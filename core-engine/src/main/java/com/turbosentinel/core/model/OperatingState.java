package com.turbosentinel.core.model;

/**
 * Operating state of a unit over the trailing state window.
 *
 * @since 1.0.0
 */
public enum OperatingState {

    RUNNING,
    LOW_SPEED,
    SHUTDOWN,

    /** No speed tag configured or no recent speed readings. Treated as RUNNING. */
    UNKNOWN;

    /**
     * Resolution order when combining per-speed-tag states into a unit state:
     * a lower rank wins.
     *
     * @return combination rank
     */
    int rank() {
        return switch (this) {
            case SHUTDOWN -> 0;
            case LOW_SPEED -> 1;
            case RUNNING -> 2;
            case UNKNOWN -> 3;
        };
    }

    /**
     * Combine two states so that the more restrictive one wins.
     *
     * @param other other state
     * @return the state with the lower rank
     */
    public OperatingState combine(OperatingState other) {
        return other.rank() < rank() ? other : this;
    }
}
