package com.turbosentinel.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.DetectorStatus;
import com.turbosentinel.core.model.FreshnessLevel;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.Priority;
import com.turbosentinel.core.model.RecencyBreakdown;
import com.turbosentinel.core.model.StateAssessment;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.TagStatus;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.report.UnitAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static com.turbosentinel.scan.ScanFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportJsonSerializer}.
 */
class ReportJsonSerializerTest {

    private ReportJsonSerializer serializer;
    private UnitAnomalyReport report;
    private TagAnomalySummary egt;

    @BeforeEach
    void setUp() {
        serializer = new ReportJsonSerializer();
        egt = TagAnomalySummary.builder("EGT")
                .status(TagStatus.ANALYZED)
                .candidateCount(8)
                .confirmedCount(3)
                .confidenceScore(60)
                .priority(Priority.CRITICAL)
                .recencyBreakdown(new RecencyBreakdown(3, 0, 0, 0))
                .weightedScore(2.9)
                .detectorCount(DetectorKind.STATISTICAL, 8)
                .detectorCount(DetectorKind.TAU_TEST, 3)
                .currentValue(510)
                .dataAge(Duration.ofMinutes(5))
                .freshness(FreshnessLevel.FRESH)
                .build();
        TagAnomalySummary cdp = TagAnomalySummary.builder("CDP").status(TagStatus.INSUFFICIENT_DATA).build();
        report = UnitAggregator.aggregate("GT-101", "North",
                new StateAssessment(OperatingState.RUNNING, List.of(), "Unit running"),
                List.of(cdp, egt), AS_OF, false, DetectorStatus.notConfigured(DetectorKind.RECONSTRUCTION));
    }

    @Test
    @DisplayName("Should write the report with ISO timestamps and ranked summaries")
    void shouldSerializeReport() throws IOException {
        JsonNode json = serializer.mapper().readTree(serializer.serialize(report, List.of(egt)));

        JsonNode unit = json.get("report");
        assertThat(unit.get("unit").asText()).isEqualTo("GT-101");
        assertThat(unit.get("generatedAt").asText()).isEqualTo("2024-06-01T00:00:00Z");
        assertThat(unit.get("scanStatus").asText()).isEqualTo("COMPLETED");
        assertThat(unit.get("operatingState").asText()).isEqualTo("RUNNING");
        assertThat(unit.get("tagSummaries").fieldNames()).toIterable().containsExactly("EGT", "CDP");
        JsonNode summary = unit.get("tagSummaries").get("EGT");
        assertThat(summary.get("priority").asText()).isEqualTo("CRITICAL");
        assertThat(summary.get("confirmedCount").asInt()).isEqualTo(3);
        assertThat(summary.get("dataAge").asText()).isEqualTo("PT5M");
        assertThat(summary.get("recencyBreakdown").get("last24h").asInt()).isEqualTo(3);
        assertThat(json.get("actionable")).hasSize(1);
        assertThat(json.get("actionable").get(0).asText()).isEqualTo("EGT");
    }
}
