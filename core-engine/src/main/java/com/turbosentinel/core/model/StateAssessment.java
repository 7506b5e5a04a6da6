package com.turbosentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Operating state of a unit together with the per-speed-tag evidence it was
 * derived from.
 *
 * @since 1.0.0
 */
public final class StateAssessment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final OperatingState state;
    private final List<SpeedTagAssessment> speedTags;
    private final String message;

    public StateAssessment(OperatingState state, List<SpeedTagAssessment> speedTags, String message) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.speedTags = List.copyOf(Objects.requireNonNull(speedTags, "speedTags must not be null"));
        this.message = message;
    }

    public static StateAssessment unknown(String message) {
        return new StateAssessment(OperatingState.UNKNOWN, List.of(), message);
    }

    public OperatingState getState() {
        return state;
    }

    public List<SpeedTagAssessment> getSpeedTags() {
        return speedTags;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StateAssessment that))
            return false;
        return state == that.state && speedTags.equals(that.speedTags)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, speedTags, message);
    }

    @Override
    public String toString() {
        return "StateAssessment{state=" + state + ", speedTags=" + speedTags + '}';
    }
}
