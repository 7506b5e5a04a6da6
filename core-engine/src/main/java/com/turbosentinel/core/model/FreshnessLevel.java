package com.turbosentinel.core.model;

import java.time.Duration;

/**
 * How old a tag's latest reading is at the analysis instant. Informational
 * only, it does not gate detection.
 *
 * @since 1.0.0
 */
public enum FreshnessLevel {

    FRESH,
    MILDLY_STALE,
    STALE,
    SEVERELY_STALE,

    /** The series has no readings at all. */
    NO_DATA;

    private static final Duration MILD_LIMIT = Duration.ofHours(48);
    private static final Duration STALE_LIMIT = Duration.ofDays(7);

    /**
     * @param age        age of the latest reading
     * @param staleAfter age up to which data counts as fresh
     * @return freshness level for {@code age}
     */
    public static FreshnessLevel of(Duration age, Duration staleAfter) {
        if (age == null) {
            return NO_DATA;
        }
        if (age.compareTo(staleAfter) <= 0) {
            return FRESH;
        }
        if (age.compareTo(MILD_LIMIT) <= 0) {
            return MILDLY_STALE;
        }
        if (age.compareTo(STALE_LIMIT) <= 0) {
            return STALE;
        }
        return SEVERELY_STALE;
    }
}
