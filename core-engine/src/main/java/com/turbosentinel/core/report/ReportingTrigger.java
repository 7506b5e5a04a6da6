package com.turbosentinel.core.report;

import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.scoring.RecencyGate;

import java.util.List;
import java.util.Objects;

/**
 * Selects the summaries of a report that warrant a notification.
 *
 * <p>
 * The gate is re-applied here instead of trusting the lifecycle state, so a
 * report deserialised from elsewhere is judged by the same rules.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportingTrigger {

    private final RecencyGate gate;

    public ReportingTrigger(RecencyGate gate) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
    }

    /**
     * @param report unit report
     * @return actionable summaries in ranked order
     */
    public List<TagAnomalySummary> getActionableAnomalies(UnitAnomalyReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return report.getTagSummaries().values().stream()
                .filter(gate::isActionable)
                .toList();
    }

    public boolean hasActionableAnomalies(UnitAnomalyReport report) {
        return !getActionableAnomalies(report).isEmpty();
    }
}
