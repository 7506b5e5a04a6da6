package com.turbosentinel.scan;

import com.turbosentinel.core.model.SensorSample;
import com.turbosentinel.core.source.InMemorySeriesRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Synthetic unit data for the scan tests.
 */
final class ScanFixtures {

    static final Instant AS_OF = Instant.parse("2024-06-01T00:00:00Z");
    static final Duration STEP = Duration.ofMinutes(10);
    static final int SAMPLES = 1000;

    private ScanFixtures() {
    }

    /**
     * Store {@link #SAMPLES} readings alternating around {@code mean}; when
     * {@code excursion} is set the last eight jump ten units.
     */
    static void store(InMemorySeriesRepository repository, String unit, String tag, double mean, boolean excursion) {
        Random random = new Random(tag.hashCode());
        for (int i = 0; i < SAMPLES; i++) {
            double value = mean + (i % 2 == 0 ? 1.0 : -1.0) + (random.nextDouble() - 0.5) * 0.2;
            if (excursion && i >= SAMPLES - 8) {
                value = mean + 10;
            }
            Instant ts = AS_OF.minus(STEP.multipliedBy(SAMPLES - 1L - i));
            repository.add(unit, new SensorSample(tag, ts, value, unit, "North"));
        }
    }
}
