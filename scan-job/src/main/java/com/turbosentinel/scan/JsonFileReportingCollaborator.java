package com.turbosentinel.scan;

import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.UnitAnomalyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes each published report as {@code <unit>-<epochSeconds>.json} into a
 * directory.
 */
public class JsonFileReportingCollaborator implements ReportingCollaborator {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileReportingCollaborator.class);

    private final Path directory;
    private final ReportJsonSerializer serializer;

    public JsonFileReportingCollaborator(Path directory, ReportJsonSerializer serializer) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
    }

    /**
     * @throws UncheckedIOException if the file cannot be written
     */
    @Override
    public void publish(UnitAnomalyReport report, List<TagAnomalySummary> actionable) {
        Path file = directory.resolve(fileName(report));
        try {
            Files.createDirectories(directory);
            Files.write(file, serializer.serialize(report, actionable));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + file, e);
        }
        LOG.info("Report for unit {} written to {} ({} actionable)", report.getUnit(), file, actionable.size());
    }

    static String fileName(UnitAnomalyReport report) {
        String unit = report.getUnit().replaceAll("[^A-Za-z0-9._-]", "_");
        return unit + "-" + report.getGeneratedAt().getEpochSecond() + ".json";
    }
}
