package com.turbosentinel.core.report;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.DetectorStatus;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.Priority;
import com.turbosentinel.core.model.RecencyBreakdown;
import com.turbosentinel.core.model.ScanStatus;
import com.turbosentinel.core.model.StateAssessment;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.TagLifecycleState;
import com.turbosentinel.core.model.TagStatus;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.model.UnitTotals;
import com.turbosentinel.core.scoring.RecencyGate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.turbosentinel.core.SeriesFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link UnitAggregator} and {@link ReportingTrigger}.
 */
class UnitAggregatorTest {

    private static final StateAssessment RUNNING = new StateAssessment(OperatingState.RUNNING, List.of(), "Unit running");

    @Test
    @DisplayName("Should rank by severity, then confirmed count, then tag")
    void shouldRankSummaries() {
        TagAnomalySummary critical = summary("C", Priority.CRITICAL, 0.5, 2);
        TagAnomalySummary high = summary("H", Priority.HIGH, 3.0, 5);
        TagAnomalySummary tieMoreConfirmed = summary("B", Priority.LOW, 1.0, 4);
        TagAnomalySummary tieA = summary("A", Priority.LOW, 1.0, 2);
        TagAnomalySummary tieZ = summary("Z", Priority.LOW, 1.0, 2);

        UnitAnomalyReport report = aggregate(List.of(tieZ, high, tieA, critical, tieMoreConfirmed));

        assertThat(report.rankedSummaries()).extracting(TagAnomalySummary::getTag)
                .containsExactly("C", "H", "B", "A", "Z");
        assertThat(report.getTagSummaries().keySet()).containsExactly("C", "H", "B", "A", "Z");
        assertThat(UnitAggregator.severity(critical)).isEqualTo(500.0);
    }

    @Test
    @DisplayName("Should total analysed, skipped and actionable tags")
    void shouldComputeTotals() {
        TagAnomalySummary actionable = summary("A", Priority.CRITICAL, 3.0, 3).toBuilder()
                .lifecycleState(TagLifecycleState.ACTIONABLE)
                .build();
        TagAnomalySummary quiet = summary("B", Priority.LOW, 0.0, 0);
        TagAnomalySummary skipped = TagAnomalySummary.builder("C").status(TagStatus.INSUFFICIENT_DATA).build();

        UnitAnomalyReport report = aggregate(List.of(actionable, quiet, skipped));

        assertThat(report.getTotals()).isEqualTo(new UnitTotals(3, 2, 1, 8, 3, 1));
        assertThat(report.getScanStatus()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(report.getOperatingState()).isEqualTo(OperatingState.RUNNING);
        assertThat(report.getGeneratedAt()).isEqualTo(AS_OF);
    }

    @Test
    @DisplayName("Should hand only actionable summaries to the reporting collaborator")
    void shouldSelectActionableForReporting() {
        TagAnomalySummary passing = summary("A", Priority.CRITICAL, 3.0, 3).toBuilder()
                .confidenceScore(60)
                .recencyBreakdown(new RecencyBreakdown(3, 0, 0, 0))
                .persistenceSatisfied(true)
                .detectorCount(DetectorKind.STATISTICAL, 8)
                .detectorCount(DetectorKind.TAU_TEST, 3)
                .build();
        TagAnomalySummary old = summary("B", Priority.LOW, 0.1, 8).toBuilder()
                .confidenceScore(90)
                .recencyBreakdown(new RecencyBreakdown(0, 0, 0, 8))
                .build();
        ReportingTrigger trigger = new ReportingTrigger(new RecencyGate(DetectionConfig.defaults()));

        UnitAnomalyReport report = aggregate(List.of(old, passing));

        assertThat(trigger.getActionableAnomalies(report)).extracting(TagAnomalySummary::getTag).containsExactly("A");
        assertThat(trigger.hasActionableAnomalies(report)).isTrue();
        assertThat(trigger.hasActionableAnomalies(aggregate(List.of(old)))).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static UnitAnomalyReport aggregate(List<TagAnomalySummary> summaries) {
        return UnitAggregator.aggregate("GT-101", "North", RUNNING, summaries, AS_OF, false,
                DetectorStatus.notConfigured(DetectorKind.RECONSTRUCTION));
    }

    private static TagAnomalySummary summary(String tag, Priority priority, double weighted, int confirmed) {
        return TagAnomalySummary.builder(tag)
                .status(TagStatus.ANALYZED)
                .candidateCount(Math.max(confirmed, 4))
                .confirmedCount(confirmed)
                .priority(priority)
                .weightedScore(weighted)
                .build();
    }
}
