package com.turbosentinel.scan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.UnitAnomalyReport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts unit reports to JSON for the reporting hand-off.
 *
 * <p>
 * Instants and durations are written as ISO-8601 strings. Tag summaries keep
 * their ranked order.
 * </p>
 */
public class ReportJsonSerializer {

    private final ObjectMapper mapper;

    public ReportJsonSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * @param report     unit report
     * @param actionable actionable summaries selected for reporting
     * @return JSON document with {@code report} and {@code actionable} fields
     * @throws IllegalStateException if the report cannot be serialized
     */
    public byte[] serialize(UnitAnomalyReport report, List<TagAnomalySummary> actionable) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(actionable, "actionable must not be null");
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("report", report);
        document.put("actionable", actionable.stream().map(TagAnomalySummary::getTag).toList());
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report of unit " + report.getUnit(), e);
        }
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
