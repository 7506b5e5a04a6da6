package com.turbosentinel.core.report;

import com.turbosentinel.core.model.DetectorStatus;
import com.turbosentinel.core.model.ScanStatus;
import com.turbosentinel.core.model.StateAssessment;
import com.turbosentinel.core.model.TagAnomalySummary;
import com.turbosentinel.core.model.TagLifecycleState;
import com.turbosentinel.core.model.UnitAnomalyReport;
import com.turbosentinel.core.model.UnitTotals;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Combines tag summaries into a ranked unit report.
 *
 * <p>
 * Ranking: severity ({@code weightedScore * priority multiplier}) descending,
 * then confirmed count descending, then tag name ascending. The aggregation is
 * a pure function of its arguments.
 * </p>
 *
 * @since 1.0.0
 */
public final class UnitAggregator {

    /** Ranking order of tag summaries. */
    public static final Comparator<TagAnomalySummary> RANKING =
            Comparator.comparingDouble(UnitAggregator::severity).reversed()
                    .thenComparing(Comparator.comparingInt(TagAnomalySummary::getConfirmedCount).reversed())
                    .thenComparing(TagAnomalySummary::getTag);

    private UnitAggregator() {
        // utility class
    }

    /**
     * @param summary tag summary
     * @return weighted score scaled by the priority multiplier
     */
    public static double severity(TagAnomalySummary summary) {
        return summary.getWeightedScore() * summary.getPriority().getSeverityMultiplier();
    }

    /**
     * @param unit                    unit name
     * @param plant                   plant name, may be {@code null}
     * @param state                   operating-state assessment
     * @param summaries               one summary per tag, any order
     * @param generatedAt             analysis instant
     * @param analysisSuppressed      whether candidate generation was suppressed
     * @param secondaryDetectorStatus reconstruction detector status, may be {@code null}
     * @return ranked report with {@link ScanStatus#COMPLETED}
     */
    public static UnitAnomalyReport aggregate(String unit, String plant, StateAssessment state,
            Collection<TagAnomalySummary> summaries, Instant generatedAt, boolean analysisSuppressed,
            DetectorStatus secondaryDetectorStatus) {
        Objects.requireNonNull(summaries, "summaries must not be null");
        List<TagAnomalySummary> ranked = new ArrayList<>(summaries);
        ranked.sort(RANKING);

        return UnitAnomalyReport.builder(unit)
                .plant(plant)
                .stateAssessment(state)
                .tagSummaries(ranked)
                .totals(totals(ranked))
                .generatedAt(generatedAt)
                .analysisSuppressed(analysisSuppressed)
                .secondaryDetectorStatus(secondaryDetectorStatus)
                .scanStatus(ScanStatus.COMPLETED)
                .build();
    }

    static UnitTotals totals(Collection<TagAnomalySummary> summaries) {
        int analyzed = 0;
        int candidates = 0;
        int confirmed = 0;
        int actionable = 0;
        for (TagAnomalySummary s : summaries) {
            if (!s.isSkipped()) {
                analyzed++;
            }
            candidates += s.getCandidateCount();
            confirmed += s.getConfirmedCount();
            if (s.getLifecycleState() == TagLifecycleState.ACTIONABLE) {
                actionable++;
            }
        }
        return new UnitTotals(summaries.size(), analyzed, summaries.size() - analyzed,
                candidates, confirmed, actionable);
    }
}
