package com.turbosentinel.core.verification;

import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.VerificationVerdict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Verdicts for every candidate of a tag plus the verifiers that were skipped.
 *
 * @since 1.0.0
 */
public final class VerificationOutcome {

    private final List<VerificationVerdict> verdicts;
    private final Map<DetectorKind, String> skipped;

    public VerificationOutcome(List<VerificationVerdict> verdicts, Map<DetectorKind, String> skipped) {
        this.verdicts = List.copyOf(Objects.requireNonNull(verdicts, "verdicts must not be null"));
        Map<DetectorKind, String> copy = new EnumMap<>(DetectorKind.class);
        copy.putAll(skipped);
        this.skipped = Collections.unmodifiableMap(copy);
    }

    public List<VerificationVerdict> getVerdicts() {
        return verdicts;
    }

    public List<VerificationVerdict> verified() {
        return verdicts.stream().filter(VerificationVerdict::isVerified).toList();
    }

    /**
     * @param kind verification detector
     * @return number of candidates {@code kind} confirmed
     */
    public int confirmedBy(DetectorKind kind) {
        return (int) verdicts.stream().filter(v -> v.getConfirmedBy().contains(kind)).count();
    }

    public Map<DetectorKind, String> getSkipped() {
        return skipped;
    }
}
