package com.turbosentinel.scan;

import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.UnitAnomalyReport;

import java.util.List;

/**
 * External consumer of unit reports. Owns all rendering and delivery.
 */
public interface ReportingCollaborator {

    /**
     * @param report     full unit report
     * @param actionable actionable summaries in ranked order, never empty
     */
    void publish(UnitAnomalyReport report, List<TagAnomalySummary> actionable);
}
