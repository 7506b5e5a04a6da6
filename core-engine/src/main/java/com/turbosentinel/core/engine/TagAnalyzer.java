package com.turbosentinel.core.engine;

import com.turbosentinel.core.baseline.Baseline;
import com.turbosentinel.core.baseline.BaselineEstimator;
import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.TagLimits;
import com.turbosentinel.core.detection.CandidateDetector;
import com.turbosentinel.core.detection.CandidateSet;
import com.turbosentinel.core.detection.ReconstructionDetector;
import com.turbosentinel.core.detection.ReconstructionResult;
import com.turbosentinel.core.error.ConfigurationException;
import com.turbosentinel.core.error.InsufficientDataException;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.FreshnessLevel;
import com.turbosentinel.core.model.RecencyBreakdown;
import com.turbosentinel.core.model.SensorSample;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.TagLifecycle;
import com.turbosentinel.core.model.TagLifecycleState;
import com.turbosentinel.core.model.TagStatus;
import com.turbosentinel.core.model.VerificationVerdict;
import com.turbosentinel.core.scoring.ConfidenceResult;
import com.turbosentinel.core.scoring.ConfidenceScorer;
import com.turbosentinel.core.scoring.EvidenceProfile;
import com.turbosentinel.core.scoring.RecencyGate;
import com.turbosentinel.core.verification.VerificationInput;
import com.turbosentinel.core.verification.VerificationLayer;
import com.turbosentinel.core.verification.VerificationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the full per-tag pipeline: baseline, candidates, verification,
 * scoring and the actionability gate.
 *
 * <p>
 * Stateless; safe to call from several worker threads at once. Every
 * statistical model is built inside the call.
 * </p>
 *
 * @since 1.0.0
 */
class TagAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TagAnalyzer.class);

    private final DetectionConfig config;
    private final BaselineEstimator baselineEstimator;
    private final CandidateDetector candidateDetector;
    private final ReconstructionDetector reconstructionDetector;
    private final VerificationLayer verificationLayer;
    private final ConfidenceScorer confidenceScorer;
    private final RecencyGate recencyGate;

    TagAnalyzer(DetectionConfig config, ReconstructionDetector reconstructionDetector,
            VerificationLayer verificationLayer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.baselineEstimator = new BaselineEstimator(config);
        this.candidateDetector = new CandidateDetector(config);
        this.reconstructionDetector = Objects.requireNonNull(reconstructionDetector,
                "reconstructionDetector must not be null");
        this.verificationLayer = Objects.requireNonNull(verificationLayer, "verificationLayer must not be null");
        this.confidenceScorer = new ConfidenceScorer(config);
        this.recencyGate = new RecencyGate(config);
    }

    TagAnomalySummary analyze(SensorSeries series, UnitContext ctx) {
        String tag = series.getTag();
        TagAnomalySummary.Builder summary = describeData(series, ctx.asOf());

        if (ctx.analysisSuppressed()) {
            return summary.status(TagStatus.SUPPRESSED_SHUTDOWN)
                    .message("Candidate generation suppressed while the unit is shut down")
                    .build();
        }
        ReconstructionResult reconstruction = ctx.reconstruction();
        if (config.isRequireSecondaryPrimaryDetector() && !reconstruction.isEnabled()) {
            return summary.status(TagStatus.SECONDARY_DETECTOR_REQUIRED)
                    .message("Reconstruction detector required but " + reconstruction.getStatus())
                    .build();
        }

        TagLimits limits = ctx.profile().limitsFor(tag).orElse(TagLimits.none());
        try {
            limits.validate(tag);
        } catch (ConfigurationException e) {
            LOG.warn("Tag '{}' skipped: {}", tag, e.getMessage());
            return summary.status(TagStatus.CONFIGURATION_ERROR).message(e.getMessage()).build();
        }

        Baseline baseline;
        try {
            baseline = baselineEstimator.estimate(series);
        } catch (InsufficientDataException e) {
            LOG.warn("Tag '{}' skipped: {}", tag, e.getMessage());
            return summary.status(e.getStatus()).message(e.getMessage()).build();
        }

        TagLifecycle lifecycle = new TagLifecycle(tag);

        // candidates
        CandidateSet statistical = candidateDetector.detect(series, baseline, ctx.asOf());
        double[] zScores = new double[series.size()];
        for (int i = 0; i < zScores.length; i++) {
            zScores[i] = baseline.zScore(i, series.valueAt(i));
        }
        List<DetectionCandidate> fromReconstruction = reconstructionDetector.candidatesFor(
                series, reconstruction, statistical.getCandidates(), zScores);
        List<DetectionCandidate> candidates = new ArrayList<>(statistical.getCandidates());
        candidates.addAll(fromReconstruction);
        candidates.sort(Comparator.comparing(DetectionCandidate::getTimestamp));
        lifecycle.transitionTo(TagLifecycleState.CANDIDATE_GENERATED);

        // verification
        VerificationOutcome outcome = verificationLayer.verify(new VerificationInput(series, candidates, limits));
        List<VerificationVerdict> verified = outcome.verified();
        lifecycle.transitionTo(verified.isEmpty() ? TagLifecycleState.REJECTED : TagLifecycleState.VERIFIED);

        // scoring
        List<Instant> verifiedTimes = verified.stream().map(v -> v.getCandidate().getTimestamp()).toList();
        RecencyBreakdown recency = recencyGate.breakdown(verifiedTimes, ctx.asOf());
        double weighted = recencyGate.weightedScore(verifiedTimes, ctx.asOf());

        Map<DetectorKind, Integer> counts = new EnumMap<>(DetectorKind.class);
        counts.put(DetectorKind.STATISTICAL, statistical.size());
        counts.put(DetectorKind.RECONSTRUCTION, fromReconstruction.size());
        counts.put(DetectorKind.TAU_TEST, outcome.confirmedBy(DetectorKind.TAU_TEST));
        counts.put(DetectorKind.OUTLIER_FOREST, outcome.confirmedBy(DetectorKind.OUTLIER_FOREST));

        EvidenceProfile.Builder evidence = EvidenceProfile.builder()
                .candidateCount(candidates.size())
                .confirmedCount(verified.size())
                .sampleCount(series.size())
                .longestRecentRun(statistical.getLongestRecentRun())
                .recency(recency)
                .weightedScore(weighted)
                .operatingState(ctx.state().getState());
        counts.forEach(evidence::detectorCount);
        ConfidenceResult confidence = confidenceScorer.score(evidence.build());
        lifecycle.transitionTo(TagLifecycleState.SCORED);

        Map<DetectorKind, String> skipped = new EnumMap<>(DetectorKind.class);
        skipped.putAll(outcome.getSkipped());
        if (!reconstruction.isEnabled()) {
            skipped.put(DetectorKind.RECONSTRUCTION, reconstruction.getStatus().getReason());
        }

        double baselineMean = baseline.latestMean();
        double current = series.valueAt(series.size() - 1);
        summary.status(TagStatus.ANALYZED)
                .candidateCount(candidates.size())
                .confirmedCount(verified.size())
                .confidenceScore(confidence.getScore())
                .confidenceBreakdown(confidence.getBreakdown())
                .priority(confidence.getPriority())
                .recencyBreakdown(recency)
                .baselineMean(baselineMean)
                .deviationPercentage(baselineMean != 0 ? (current - baselineMean) / Math.abs(baselineMean) * 100.0 : 0.0)
                .weightedScore(weighted)
                .longestRecentRun(statistical.getLongestRecentRun())
                .persistenceSatisfied(statistical.isPersistenceSatisfied())
                .skippedDetectors(skipped)
                .lifecycleState(lifecycle.getState());
        counts.forEach(summary::detectorCount);

        boolean actionable = recencyGate.isActionable(summary.build());
        lifecycle.transitionTo(actionable ? TagLifecycleState.ACTIONABLE : TagLifecycleState.SUPPRESSED);
        LOG.debug("Tag '{}': {} candidate(s), {} verified, confidence {}, {} -> {}", tag, candidates.size(),
                verified.size(), confidence.getScore(), confidence.getPriority(), lifecycle.getState());
        return summary.lifecycleState(lifecycle.getState()).build();
    }

    /**
     * Summary for a tag that could not be analysed at all.
     */
    TagAnomalySummary skipped(SensorSeries series, Instant asOf, TagStatus status, String message) {
        return describeData(series, asOf).status(status).message(message).build();
    }

    private TagAnomalySummary.Builder describeData(SensorSeries series, Instant asOf) {
        TagAnomalySummary.Builder b = TagAnomalySummary.builder(series.getTag());
        if (series.isEmpty()) {
            return b.freshness(FreshnessLevel.NO_DATA);
        }
        SensorSample latest = series.getSamples().get(series.size() - 1);
        Duration age = Duration.between(latest.getTimestamp(), asOf);
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        return b.currentValue(latest.getValue())
                .dataAge(age)
                .freshness(FreshnessLevel.of(age, config.getStaleAfter()));
    }
}
