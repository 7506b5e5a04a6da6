package com.turbosentinel.core.verification;

import com.turbosentinel.core.error.DetectorUnavailableException;
import com.turbosentinel.core.model.DetectorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Cooperative execution-time budget of one verifier run. Verifiers call
 * {@link #check()} between units of work.
 *
 * @since 1.0.0
 */
public final class Deadline {

    private final DetectorKind detector;
    private final Duration budget;
    private final long deadlineNanos;

    private Deadline(DetectorKind detector, Duration budget) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.deadlineNanos = System.nanoTime() + budget.toNanos();
    }

    public static Deadline start(DetectorKind detector, Duration budget) {
        return new Deadline(detector, budget);
    }

    public boolean isExpired() {
        return System.nanoTime() - deadlineNanos > 0;
    }

    /**
     * @throws DetectorUnavailableException if the budget is used up
     */
    public void check() {
        if (isExpired()) {
            throw new DetectorUnavailableException(detector,
                    detector + " exceeded its time budget of " + budget.toMillis() + " ms");
        }
    }
}
