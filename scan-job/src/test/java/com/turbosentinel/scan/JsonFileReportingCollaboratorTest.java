package com.turbosentinel.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.turbosentinel.core.model.Priority;
import com.turbosentinel.core.model.StateAssessment;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.UnitAnomalyReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.turbosentinel.scan.ScanFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonFileReportingCollaborator}.
 */
class JsonFileReportingCollaboratorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write one JSON file per published report")
    void shouldWriteReportFile() throws IOException {
        ReportJsonSerializer serializer = new ReportJsonSerializer();
        Path out = tempDir.resolve("reports");
        JsonFileReportingCollaborator collaborator = new JsonFileReportingCollaborator(out, serializer);
        TagAnomalySummary egt = TagAnomalySummary.builder("EGT").priority(Priority.HIGH).build();

        collaborator.publish(report("GT-101"), List.of(egt));

        Path file = out.resolve("GT-101-" + AS_OF.getEpochSecond() + ".json");
        assertThat(file).exists();
        JsonNode json = serializer.mapper().readTree(Files.readAllBytes(file));
        assertThat(json.get("report").get("unit").asText()).isEqualTo("GT-101");
        assertThat(json.get("actionable").get(0).asText()).isEqualTo("EGT");
    }

    @Test
    @DisplayName("Should sanitize unit names in file names")
    void shouldSanitizeFileName() {
        assertThat(JsonFileReportingCollaborator.fileName(report("North/GT 7")))
                .isEqualTo("North_GT_7-" + AS_OF.getEpochSecond() + ".json");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static UnitAnomalyReport report(String unit) {
        return UnitAnomalyReport.builder(unit)
                .stateAssessment(StateAssessment.unknown("No speed tags"))
                .generatedAt(AS_OF)
                .build();
    }
}
