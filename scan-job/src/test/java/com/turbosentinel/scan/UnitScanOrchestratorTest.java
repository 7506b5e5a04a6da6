package com.turbosentinel.scan;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.engine.AnomalyEngine;
import com.turbosentinel.core.engine.CancellationToken;
import com.turbosentinel.core.error.UpstreamDataException;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.ScanStatus;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.TagStatus;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.report.ReportingTrigger;
import com.turbosentinel.core.scoring.RecencyGate;
import com.turbosentinel.core.source.InMemorySeriesRepository;
import com.turbosentinel.core.source.SeriesRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.turbosentinel.scan.ScanFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link UnitScanOrchestrator} over in-memory storage.
 */
class UnitScanOrchestratorTest {

    private DetectionConfig config;
    private AnomalyEngine engine;
    private InMemorySeriesRepository repository;
    private RecordingCollaborator collaborator;

    @BeforeEach
    void setUp() {
        config = DetectionConfig.builder().workerThreads(2).build();
        engine = new AnomalyEngine(config, Clock.fixed(AS_OF, ZoneOffset.UTC));
        repository = new InMemorySeriesRepository();
        collaborator = new RecordingCollaborator();

        ScanFixtures.store(repository, "GT-101", "EGT", 500, true);
        ScanFixtures.store(repository, "GT-101", "CDP", 12, false);
        ScanFixtures.store(repository, "GT-102", "EGT", 480, false);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should publish only units with actionable anomalies")
    void shouldPublishActionableUnits() {
        UnitScanOrchestrator orchestrator = orchestrator(repository, collaborator, 1);

        List<UnitAnomalyReport> reports = orchestrator.scanAll(profiles(), AS_OF, CancellationToken.none());

        assertThat(reports).extracting(UnitAnomalyReport::getUnit).containsExactly("GT-101", "GT-102");
        assertThat(reports).extracting(UnitAnomalyReport::getScanStatus).containsOnly(ScanStatus.COMPLETED);
        assertThat(collaborator.units).containsExactly("GT-101");
        assertThat(collaborator.actionable).containsExactly(List.of("EGT"));
    }

    @Test
    @DisplayName("Should fetch monitored tags that are missing from storage")
    void shouldIncludeMonitoredTags() {
        UnitProfile profile = UnitProfile.builder("GT-102").monitoredTags(List.of("EGT", "VIB")).build();

        UnitAnomalyReport report = orchestrator(repository, collaborator, 1)
                .scanUnit(profile, AS_OF, CancellationToken.none());

        assertThat(report.getTagSummaries()).containsOnlyKeys("EGT", "VIB");
        assertThat(report.getTagSummaries().get("VIB").getStatus()).isEqualTo(TagStatus.INSUFFICIENT_DATA);
        assertThat(collaborator.units).isEmpty();
    }

    @Test
    @DisplayName("Should mark only the failing unit as UPSTREAM_FAILURE")
    void shouldIsolateUpstreamFailure() {
        SeriesRepository flaky = new SeriesRepository() {
            @Override
            public SensorSeries getSeries(String tag, String unit, Instant start, Instant end) {
                if ("GT-102".equals(unit)) {
                    throw new UpstreamDataException("Historian timeout for " + tag);
                }
                return repository.getSeries(tag, unit, start, end);
            }

            @Override
            public List<String> getAllTags(String unit) {
                return repository.getAllTags(unit);
            }
        };

        List<UnitAnomalyReport> reports = orchestrator(flaky, collaborator, 1)
                .scanAll(profiles(), AS_OF, CancellationToken.none());

        assertThat(reports.get(0).getScanStatus()).isEqualTo(ScanStatus.COMPLETED);
        UnitAnomalyReport failed = reports.get(1);
        assertThat(failed.getScanStatus()).isEqualTo(ScanStatus.UPSTREAM_FAILURE);
        assertThat(failed.getOperatingState()).isEqualTo(OperatingState.UNKNOWN);
        assertThat(failed.getMessage()).contains("Historian timeout");
        assertThat(failed.getTagSummaries()).isEmpty();
        assertThat(failed.getGeneratedAt()).isEqualTo(AS_OF);
        assertThat(collaborator.units).containsExactly("GT-101");
    }

    @Test
    @DisplayName("Should keep scanning when the reporting collaborator fails")
    void shouldIsolateCollaboratorFailure() {
        ReportingCollaborator failing = (report, actionable) -> {
            throw new IllegalStateException("sink down");
        };

        List<UnitAnomalyReport> reports = orchestrator(repository, failing, 1)
                .scanAll(profiles(), AS_OF, CancellationToken.none());

        assertThat(reports).hasSize(2);
        assertThat(reports.get(0).getTotals().getActionable()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should produce the same reports when scanning units in parallel")
    void shouldScanInParallel() {
        List<UnitAnomalyReport> sequential = orchestrator(repository, new RecordingCollaborator(), 1)
                .scanAll(profiles(), AS_OF, CancellationToken.none());
        List<UnitAnomalyReport> parallel = orchestrator(repository, collaborator, 2)
                .scanAll(profiles(), AS_OF, CancellationToken.none());

        assertThat(parallel).isEqualTo(sequential);
        assertThat(collaborator.units).containsExactly("GT-101");
    }

    @Test
    @DisplayName("Should report cancelled tags once the token is cancelled")
    void shouldHonourCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        UnitAnomalyReport report = orchestrator(repository, collaborator, 1)
                .scanUnit(profiles().get(0), AS_OF, token);

        assertThat(report.getScanStatus()).isEqualTo(ScanStatus.CANCELLED);
        assertThat(report.getTagSummaries().values()).extracting(TagAnomalySummary::getStatus)
                .containsOnly(TagStatus.CANCELLED);
        assertThat(collaborator.units).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private UnitScanOrchestrator orchestrator(SeriesRepository source, ReportingCollaborator sink, int parallelism) {
        ScanJobConfig jobConfig = new ScanJobConfig.Builder().unitParallelism(parallelism).build();
        return new UnitScanOrchestrator(engine, source, new ReportingTrigger(new RecencyGate(config)), sink,
                jobConfig);
    }

    private static List<UnitProfile> profiles() {
        return List.of(
                UnitProfile.builder("GT-101").plant("North").build(),
                UnitProfile.builder("GT-102").plant("North").build());
    }

    private static final class RecordingCollaborator implements ReportingCollaborator {
        final List<String> units = Collections.synchronizedList(new ArrayList<>());
        final List<List<String>> actionable = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void publish(UnitAnomalyReport report, List<TagAnomalySummary> tags) {
            units.add(report.getUnit());
            actionable.add(tags.stream().map(TagAnomalySummary::getTag).toList());
        }
    }
}
