package com.turbosentinel.core.verification;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.model.DetectorKind;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Creates {@link Verifier} instances for a run.
 *
 * <p>
 * Register new verification detectors here.
 * </p>
 *
 * @since 1.0.0
 */
public final class VerifierFactory {

    private VerifierFactory() {
        // utility class
    }

    /**
     * @param kind   verification detector to create
     * @param config detection configuration; must not be {@code null}
     * @return a new verifier
     * @throws IllegalArgumentException if {@code kind} is not a verification detector
     */
    public static Verifier create(DetectorKind kind, DetectionConfig config) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return switch (kind) {
            case TAU_TEST -> new TauVerifier(config);
            case OUTLIER_FOREST -> new OutlierForestVerifier(config);
            default -> throw new IllegalArgumentException(kind + " is not a verification detector");
        };
    }

    /**
     * @param config detection configuration
     * @return one verifier per verification detector, in declaration order
     */
    public static List<Verifier> createAll(DetectionConfig config) {
        return Arrays.stream(DetectorKind.values())
                .filter(DetectorKind::isVerification)
                .map(kind -> create(kind, config))
                .toList();
    }
}
