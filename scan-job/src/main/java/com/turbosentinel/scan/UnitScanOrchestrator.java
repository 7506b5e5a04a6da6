package com.turbosentinel.scan;

import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.engine.AnomalyEngine;
import com.turbosentinel.core.engine.CancellationToken;
import com.turbosentinel.core.error.UpstreamDataException;
import com.turbosentinel.core.model.ScanStatus;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.StateAssessment;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.report.ReportingTrigger;
import com.turbosentinel.core.source.SeriesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scans units: fetches their series, runs the engine and hands actionable
 * anomalies to the {@link ReportingCollaborator}.
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A storage failure for one unit produces a report with
 * {@link ScanStatus#UPSTREAM_FAILURE} for that unit only. A failing
 * collaborator is logged and does not affect other units.
 * </p>
 *
 * <h3>Reporting</h3>
 * <p>
 * The collaborator is invoked only for reports with at least one actionable
 * anomaly, as selected by the {@link ReportingTrigger}.
 * </p>
 *
 * @since 1.0.0
 */
public class UnitScanOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(UnitScanOrchestrator.class);

    private final AnomalyEngine engine;
    private final SeriesRepository repository;
    private final ReportingTrigger trigger;
    private final ReportingCollaborator collaborator;
    private final Duration lookback;
    private final int unitParallelism;

    public UnitScanOrchestrator(AnomalyEngine engine, SeriesRepository repository, ReportingTrigger trigger,
            ReportingCollaborator collaborator, ScanJobConfig config) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.collaborator = Objects.requireNonNull(collaborator, "collaborator must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.lookback = config.getLookback();
        this.unitParallelism = config.getUnitParallelism();
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Scan every unit as of {@code asOf}.
     *
     * @return one report per unit, in profile order
     */
    public List<UnitAnomalyReport> scanAll(List<UnitProfile> profiles, Instant asOf, CancellationToken token) {
        Objects.requireNonNull(profiles, "profiles must not be null");
        LOG.info("Scanning {} unit(s) as of {}", profiles.size(), asOf);
        if (unitParallelism == 1 || profiles.size() <= 1) {
            List<UnitAnomalyReport> reports = new ArrayList<>(profiles.size());
            for (UnitProfile profile : profiles) {
                reports.add(scanUnit(profile, asOf, token));
            }
            return reports;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(unitParallelism, profiles.size()));
        try {
            List<Future<UnitAnomalyReport>> futures = new ArrayList<>(profiles.size());
            for (UnitProfile profile : profiles) {
                futures.add(pool.submit(() -> scanUnit(profile, asOf, token)));
            }
            List<UnitAnomalyReport> reports = new ArrayList<>(profiles.size());
            for (Future<UnitAnomalyReport> future : futures) {
                reports.add(future.get());
            }
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scanning units", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unit scan failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Scan one unit.
     *
     * @param profile unit profile
     * @param asOf    scan instant
     * @param token   cooperative cancellation
     * @return the unit report; {@code UPSTREAM_FAILURE} if its series could not
     *         be fetched
     */
    public UnitAnomalyReport scanUnit(UnitProfile profile, Instant asOf, CancellationToken token) {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");

        Map<String, SensorSeries> seriesByTag;
        try {
            seriesByTag = fetch(profile, asOf);
        } catch (UpstreamDataException e) {
            LOG.error("Unit {}: failed to fetch series", profile.getUnit(), e);
            return UnitAnomalyReport.builder(profile.getUnit())
                    .plant(profile.getPlant())
                    .stateAssessment(StateAssessment.unknown("Series unavailable"))
                    .generatedAt(asOf)
                    .scanStatus(ScanStatus.UPSTREAM_FAILURE)
                    .message(e.getMessage())
                    .build();
        }

        UnitAnomalyReport report = engine.analyzeUnit(profile, seriesByTag, asOf, token);
        List<TagAnomalySummary> actionable = trigger.getActionableAnomalies(report);
        if (!actionable.isEmpty()) {
            publish(report, actionable);
        } else {
            LOG.info("Unit {}: no actionable anomalies", profile.getUnit());
        }
        return report;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Map<String, SensorSeries> fetch(UnitProfile profile, Instant asOf) {
        String unit = profile.getUnit();
        Set<String> tags = new LinkedHashSet<>(repository.getAllTags(unit));
        tags.addAll(profile.getMonitoredTags());
        tags.addAll(profile.getSpeedTags());
        tags.addAll(profile.getFeatureTags());

        Instant start = asOf.minus(lookback);
        Map<String, SensorSeries> seriesByTag = new HashMap<>();
        for (String tag : tags) {
            SensorSeries series = repository.getSeries(tag, unit, start, asOf);
            if (!series.isEmpty()) {
                seriesByTag.put(tag, series);
            }
        }
        LOG.debug("Unit {}: fetched {} series for {} tag(s)", unit, seriesByTag.size(), tags.size());
        return seriesByTag;
    }

    private void publish(UnitAnomalyReport report, List<TagAnomalySummary> actionable) {
        try {
            collaborator.publish(report, actionable);
        } catch (RuntimeException e) {
            LOG.error("Unit {}: reporting collaborator failed", report.getUnit(), e);
        }
    }
}
