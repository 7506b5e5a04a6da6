package com.turbosentinel.scan;

import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.UnitAnomalyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes one log line per actionable anomaly. Used when no report directory
 * is configured.
 */
public class LoggingReportingCollaborator implements ReportingCollaborator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingReportingCollaborator.class);

    @Override
    public void publish(UnitAnomalyReport report, List<TagAnomalySummary> actionable) {
        for (TagAnomalySummary summary : actionable) {
            LOG.warn("Actionable anomaly on unit {} tag '{}': priority={}, confidence={}, confirmed={}/{}, last24h={}",
                    report.getUnit(), summary.getTag(), summary.getPriority(),
                    String.format("%.1f", summary.getConfidenceScore()), summary.getConfirmedCount(),
                    summary.getCandidateCount(), summary.getRecencyBreakdown().getLast24h());
        }
    }
}
