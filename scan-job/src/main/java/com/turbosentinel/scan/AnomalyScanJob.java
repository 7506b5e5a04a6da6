package com.turbosentinel.scan;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.EngineConfigLoader;
import com.turbosentinel.core.config.EngineSettings;
import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.engine.AnomalyEngine;
import com.turbosentinel.core.engine.CancellationToken;
import com.turbosentinel.core.model.ScanStatus;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.report.ReportingTrigger;
import com.turbosentinel.core.scoring.RecencyGate;
import com.turbosentinel.core.source.InMemorySeriesRepository;
import com.turbosentinel.core.source.SeriesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the scan job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   engine YAML  -> DetectionConfig + UnitProfiles
 *   sample file  -> InMemorySeriesRepository
 *   per unit     -> fetch series -> AnomalyEngine -> ReportingTrigger
 *                -> ReportingCollaborator (JSON files or log)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings are resolved from environment variables via
 * {@link ScanJobConfig}; detection settings from the engine YAML via
 * {@link EngineConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyScanJob implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyScanJob.class);

    private final List<UnitProfile> profiles;
    private final AnomalyEngine engine;
    private final UnitScanOrchestrator orchestrator;
    private final Clock clock;
    private final CancellationToken token = new CancellationToken();

    /**
     * @param settings     validated engine settings
     * @param config       job configuration
     * @param repository   series storage
     * @param collaborator reporting collaborator
     * @param clock        source of the scan instant
     */
    public AnomalyScanJob(EngineSettings settings, ScanJobConfig config, SeriesRepository repository,
            ReportingCollaborator collaborator, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        DetectionConfig detectionConfig = settings.toDetectionConfig();
        this.profiles = settings.toUnitProfiles();
        this.engine = new AnomalyEngine(detectionConfig, clock);
        this.orchestrator = new UnitScanOrchestrator(engine, repository,
                new ReportingTrigger(new RecencyGate(detectionConfig)), collaborator, config);
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        ScanJobConfig config = ScanJobConfig.fromEnvironment();
        LOG.info("Starting Turbo Sentinel scan with config: {}", config);
        EngineSettings settings = loadSettings(config);
        if (settings.getUnits().isEmpty()) {
            throw new IllegalStateException("No units defined. Provide units via "
                    + EngineConfigLoader.ENV_CONFIG_PATH + " or a classpath "
                    + EngineConfigLoader.DEFAULT_RESOURCE + " file.");
        }

        // 2. Load series
        InMemorySeriesRepository repository = new InMemorySeriesRepository();
        if (config.getSeriesInputPath().isBlank()) {
            LOG.warn("SERIES_INPUT_PATH not set, scanning without data");
        } else {
            new SampleJsonReader().load(Path.of(config.getSeriesInputPath()), repository);
        }

        // 3. Reporting
        ReportingCollaborator collaborator = config.getReportOutputDir().isBlank()
                ? new LoggingReportingCollaborator()
                : new JsonFileReportingCollaborator(Path.of(config.getReportOutputDir()), new ReportJsonSerializer());

        // 4. Scan
        try (AnomalyScanJob job = new AnomalyScanJob(settings, config, repository, collaborator, Clock.systemUTC())) {
            if (!config.isRepeating()) {
                job.runOnce();
                return;
            }
            runRepeatedly(job, config.getScanIntervalMinutes());
        }
    }

    /**
     * Scan every configured unit once, as of the clock's current instant.
     *
     * @return one report per unit
     */
    public List<UnitAnomalyReport> runOnce() {
        List<UnitAnomalyReport> reports = orchestrator.scanAll(profiles, clock.instant(), token);
        long failed = reports.stream().filter(r -> r.getScanStatus() == ScanStatus.UPSTREAM_FAILURE).count();
        int actionable = reports.stream().mapToInt(r -> r.getTotals().getActionable()).sum();
        LOG.info("Scan finished: {} unit(s), {} upstream failure(s), {} actionable tag(s)",
                reports.size(), failed, actionable);
        return reports;
    }

    /**
     * Cancel a running scan; tags not yet started are reported as cancelled.
     */
    public void cancel() {
        token.cancel();
    }

    @Override
    public void close() {
        engine.close();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EngineSettings loadSettings(ScanJobConfig config) {
        String path = config.getEngineConfigPath();
        if (path != null && !path.isBlank()) {
            return EngineConfigLoader.fromFile(path);
        }
        return EngineConfigLoader.load();
    }

    private static void runRepeatedly(AnomalyScanJob job, int intervalMinutes) throws InterruptedException {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "turbo-sentinel-scheduler");
            t.setDaemon(true);
            return t;
        });
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            job.cancel();
            stopped.countDown();
        }, "scan-shutdown"));

        scheduler.scheduleWithFixedDelay(() -> {
            try {
                job.runOnce();
            } catch (RuntimeException e) {
                LOG.error("Scan failed", e);
            }
        }, 0, intervalMinutes, TimeUnit.MINUTES);
        try {
            stopped.await();
        } finally {
            scheduler.shutdownNow();
        }
    }
}
