package com.turbosentinel.scan;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.turbosentinel.core.error.UpstreamDataException;
import com.turbosentinel.core.model.SensorSample;
import com.turbosentinel.core.source.InMemorySeriesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a JSON-lines file of {@link SampleRecord}s into an
 * {@link InMemorySeriesRepository}.
 *
 * <p>
 * Malformed or incomplete lines are logged and skipped, so a single bad record
 * does not abort the load. An unreadable file is an upstream failure.
 * </p>
 */
public class SampleJsonReader {

    private static final Logger LOG = LoggerFactory.getLogger(SampleJsonReader.class);

    private final ObjectMapper mapper;

    public SampleJsonReader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param path       JSON-lines file
     * @param repository repository to fill
     * @return number of samples stored
     * @throws UpstreamDataException if the file cannot be read
     */
    public int load(Path path, InMemorySeriesRepository repository) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(repository, "repository must not be null");

        int stored = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                SensorSample sample = parse(line, lineNumber);
                if (sample == null) {
                    skipped++;
                    continue;
                }
                repository.add(sample.getUnit(), sample);
                stored++;
            }
        } catch (IOException e) {
            throw new UpstreamDataException("Failed to read sample file " + path + ": " + e.getMessage(), e);
        }
        LOG.info("Loaded {} sample(s) from {} ({} skipped)", stored, path, skipped);
        return stored;
    }

    /**
     * @return the sample, or {@code null} when the line cannot be used
     */
    SensorSample parse(String line, int lineNumber) {
        try {
            SampleRecord record = mapper.readValue(line, SampleRecord.class);
            if (record.getUnit() == null || record.getTag() == null || record.getTimestamp() == null
                    || record.getValue() == null) {
                LOG.warn("Line {}: incomplete sample, skipping", lineNumber);
                return null;
            }
            return new SensorSample(record.getTag(), record.getTimestamp(), record.getValue(),
                    record.getUnit(), record.getPlant());
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Line {}: failed to parse sample, skipping: {}", lineNumber, e.getMessage());
            return null;
        }
    }
}
