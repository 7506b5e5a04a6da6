package com.turbosentinel.core.verification;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.error.DetectorUnavailableException;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.VerificationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs every verifier against a tag's candidates and combines the results.
 *
 * <p>
 * A candidate is verified when at least one verifier confirms it. A verifier
 * that throws, whether {@link DetectorUnavailableException} or an unexpected
 * failure inside its model, is recorded as skipped; it neither confirms nor
 * rejects anything and the remaining verifiers still run.
 * </p>
 *
 * @since 1.0.0
 */
public class VerificationLayer {

    private static final Logger LOG = LoggerFactory.getLogger(VerificationLayer.class);

    private final List<Verifier> verifiers;
    private final DetectionConfig config;

    public VerificationLayer(DetectionConfig config) {
        this(config, VerifierFactory.createAll(config));
    }

    public VerificationLayer(DetectionConfig config, List<Verifier> verifiers) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.verifiers = List.copyOf(Objects.requireNonNull(verifiers, "verifiers must not be null"));
    }

    /**
     * @param input series, candidates and limits of one tag
     * @return one verdict per candidate, in candidate order
     */
    public VerificationOutcome verify(VerificationInput input) {
        Objects.requireNonNull(input, "input must not be null");
        if (input.getCandidates().isEmpty()) {
            return new VerificationOutcome(List.of(), Map.of());
        }

        List<VerifierResult> results = new ArrayList<>();
        Map<DetectorKind, String> skipped = new EnumMap<>(DetectorKind.class);
        for (Verifier verifier : verifiers) {
            Deadline deadline = Deadline.start(verifier.kind(), config.getVerifierTimeBudget());
            try {
                results.add(verifier.verify(input, deadline));
            } catch (DetectorUnavailableException e) {
                LOG.warn("Tag '{}': {} skipped: {}", input.getSeries().getTag(), verifier.kind(), e.getMessage());
                skipped.put(verifier.kind(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("Tag '{}': {} failed, skipping", input.getSeries().getTag(), verifier.kind(), e);
                skipped.put(verifier.kind(), e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        List<VerificationVerdict> verdicts = new ArrayList<>(input.getCandidates().size());
        for (DetectionCandidate candidate : input.getCandidates()) {
            Set<DetectorKind> confirmedBy = EnumSet.noneOf(DetectorKind.class);
            Map<DetectorKind, Double> scores = new EnumMap<>(DetectorKind.class);
            for (VerifierResult result : results) {
                Double score = result.getScores().get(candidate.getTimestamp());
                if (score != null) {
                    scores.put(result.getDetector(), score);
                }
                if (result.isConfirmed(candidate.getTimestamp())) {
                    confirmedBy.add(result.getDetector());
                }
            }
            verdicts.add(new VerificationVerdict(candidate, confirmedBy, scores));
        }
        return new VerificationOutcome(verdicts, skipped);
    }
}
