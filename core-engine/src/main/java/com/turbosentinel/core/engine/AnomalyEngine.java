package com.turbosentinel.core.engine;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.ShutdownPolicy;
import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.detection.ReconstructionDetector;
import com.turbosentinel.core.detection.ReconstructionResult;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.ScanStatus;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.StateAssessment;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.TagStatus;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.report.UnitAggregator;
import com.turbosentinel.core.state.StateClassifier;
import com.turbosentinel.core.verification.VerificationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the detection engine: analyses every tag of one unit and
 * returns a ranked report.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Classify the unit's operating state from its speed tags.</li>
 * <li>Fit the reconstruction detector on the unit's feature tags.</li>
 * <li>Analyse each tag on a bounded worker pool (baseline, candidates,
 * verification, scoring, gate).</li>
 * <li>Join every tag task, then aggregate and rank.</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A tag that throws is reported as {@code FAILED}; the other tags and the
 * report are unaffected. Cancellation is checked before each tag starts;
 * tags not yet started are reported as {@code CANCELLED}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #analyzeUnit} may be called concurrently. The engine performs no I/O;
 * series are supplied by the caller. Call {@link #close()} to release the
 * worker pool.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    private final DetectionConfig config;
    private final Clock clock;
    private final StateClassifier stateClassifier;
    private final ReconstructionDetector reconstructionDetector;
    private final TagAnalyzer tagAnalyzer;
    private final ExecutorService workers;

    public AnomalyEngine(DetectionConfig config) {
        this(config, Clock.systemUTC());
    }

    public AnomalyEngine(DetectionConfig config, Clock clock) {
        this(config, clock, new VerificationLayer(config));
    }

    /**
     * @param config            detection configuration
     * @param clock             source of the analysis instant when none is given
     * @param verificationLayer verification stage, replaceable for tests
     */
    public AnomalyEngine(DetectionConfig config, Clock clock, VerificationLayer verificationLayer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.stateClassifier = new StateClassifier(config);
        this.reconstructionDetector = new ReconstructionDetector(config);
        this.tagAnalyzer = new TagAnalyzer(config, reconstructionDetector, verificationLayer);
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), new WorkerThreadFactory());
        LOG.info("Anomaly engine started with {} worker thread(s): {}", config.getWorkerThreads(), config);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public DetectionConfig getConfig() {
        return config;
    }

    /**
     * Analyse a unit as of the clock's current instant.
     */
    public UnitAnomalyReport analyzeUnit(UnitProfile profile, Map<String, SensorSeries> seriesByTag) {
        return analyzeUnit(profile, seriesByTag, clock.instant(), CancellationToken.none());
    }

    public UnitAnomalyReport analyzeUnit(UnitProfile profile, Map<String, SensorSeries> seriesByTag, Instant asOf) {
        return analyzeUnit(profile, seriesByTag, asOf, CancellationToken.none());
    }

    /**
     * Analyse every tag of a unit.
     *
     * <p>
     * The analysed tags are the profile's monitored tags or, when none are
     * configured, every tag in {@code seriesByTag} except the speed tags.
     * A monitored tag missing from the map is reported as
     * {@code INSUFFICIENT_DATA}.
     * </p>
     *
     * @param profile     unit profile
     * @param seriesByTag series of the unit keyed by tag, including speed and
     *                    feature tags
     * @param asOf        analysis instant; ages and windows are relative to it
     * @param token       cooperative cancellation
     * @return ranked unit report
     */
    public UnitAnomalyReport analyzeUnit(UnitProfile profile, Map<String, SensorSeries> seriesByTag, Instant asOf,
            CancellationToken token) {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(seriesByTag, "seriesByTag must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        Objects.requireNonNull(token, "token must not be null");

        String unit = profile.getUnit();
        LOG.info("Analysing unit {} as of {}", unit, asOf);

        StateAssessment state = stateClassifier.classify(profile, seriesByTag, asOf);
        boolean suppressed = state.getState() == OperatingState.SHUTDOWN
                && config.getShutdownPolicy() == ShutdownPolicy.SUPPRESS_ANALYSIS;
        if (suppressed) {
            LOG.info("Unit {} is shut down, candidate generation suppressed", unit);
        }
        ReconstructionResult reconstruction = suppressed ? null
                : reconstructionDetector.evaluate(profile, seriesByTag);
        UnitContext ctx = new UnitContext(profile, asOf, state, reconstruction, suppressed);

        List<String> tags = tagsToAnalyse(profile, seriesByTag);
        List<Future<TagAnomalySummary>> futures = new ArrayList<>(tags.size());
        for (String tag : tags) {
            SensorSeries series = seriesByTag.getOrDefault(tag, SensorSeries.empty(tag, unit));
            futures.add(workers.submit(() -> analyzeTag(series, ctx, token)));
        }

        List<TagAnomalySummary> summaries = new ArrayList<>(tags.size());
        for (int i = 0; i < futures.size(); i++) {
            summaries.add(join(futures.get(i), seriesByTag.getOrDefault(tags.get(i),
                    SensorSeries.empty(tags.get(i), unit)), asOf));
        }

        UnitAnomalyReport report = UnitAggregator.aggregate(unit, profile.getPlant(), state, summaries, asOf,
                suppressed, reconstruction != null ? reconstruction.getStatus() : null);
        if (token.isCancelled()) {
            report = report.toBuilder().scanStatus(ScanStatus.CANCELLED).message("Analysis cancelled").build();
        }
        LOG.info("Unit {} analysed: state={}, {}", unit, state.getState(), report.getTotals());
        return report;
    }

    /**
     * Stop the worker pool, waiting briefly for running tag tasks.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Anomaly engine stopped");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private TagAnomalySummary analyzeTag(SensorSeries series, UnitContext ctx, CancellationToken token) {
        if (token.isCancelled()) {
            return tagAnalyzer.skipped(series, ctx.asOf(), TagStatus.CANCELLED, "Analysis cancelled");
        }
        try {
            return tagAnalyzer.analyze(series, ctx);
        } catch (RuntimeException e) {
            LOG.error("Analysis of tag '{}' in unit {} failed", series.getTag(), ctx.profile().getUnit(), e);
            return tagAnalyzer.skipped(series, ctx.asOf(), TagStatus.FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private TagAnomalySummary join(Future<TagAnomalySummary> future, SensorSeries series, Instant asOf) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return tagAnalyzer.skipped(series, asOf, TagStatus.CANCELLED, "Interrupted while waiting");
        } catch (ExecutionException e) {
            LOG.error("Tag task for '{}' failed", series.getTag(), e.getCause());
            return tagAnalyzer.skipped(series, asOf, TagStatus.FAILED, String.valueOf(e.getCause()));
        }
    }

    private static List<String> tagsToAnalyse(UnitProfile profile, Map<String, SensorSeries> seriesByTag) {
        if (!profile.getMonitoredTags().isEmpty()) {
            return profile.getMonitoredTags().stream().distinct().sorted().toList();
        }
        Set<String> speedTags = new HashSet<>(profile.getSpeedTags());
        return seriesByTag.keySet().stream()
                .filter(tag -> !speedTags.contains(tag))
                .sorted()
                .toList();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "turbo-sentinel-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
