package com.turbosentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranked anomaly report for one equipment unit.
 *
 * <p>
 * {@link #getTagSummaries()} iterates in ranked order (highest severity
 * first). A report is produced for every unit scan, including failed and
 * suppressed ones; {@link #getScanStatus()} and {@link #isAnalysisSuppressed()}
 * tell them apart.
 * </p>
 *
 * @since 1.0.0
 */
public final class UnitAnomalyReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String unit;
    private final String plant;
    private final OperatingState operatingState;
    private final StateAssessment stateAssessment;
    private final Map<String, TagAnomalySummary> tagSummaries;
    private final UnitTotals totals;
    private final Instant generatedAt;
    private final boolean analysisSuppressed;
    private final DetectorStatus secondaryDetectorStatus;
    private final ScanStatus scanStatus;
    private final String message;

    private UnitAnomalyReport(Builder b) {
        this.unit = Objects.requireNonNull(b.unit, "unit must not be null");
        this.plant = b.plant;
        this.stateAssessment = Objects.requireNonNull(b.stateAssessment, "stateAssessment must not be null");
        this.operatingState = stateAssessment.getState();
        this.tagSummaries = Collections.unmodifiableMap(new LinkedHashMap<>(b.tagSummaries));
        this.totals = Objects.requireNonNull(b.totals, "totals must not be null");
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        this.analysisSuppressed = b.analysisSuppressed;
        this.secondaryDetectorStatus = b.secondaryDetectorStatus;
        this.scanStatus = Objects.requireNonNull(b.scanStatus, "scanStatus must not be null");
        this.message = b.message;
    }

    public static Builder builder(String unit) {
        return new Builder(unit);
    }

    /**
     * @return a builder pre-populated with this report's values
     */
    public Builder toBuilder() {
        return new Builder(unit)
                .plant(plant)
                .stateAssessment(stateAssessment)
                .tagSummaries(rankedSummaries())
                .totals(totals)
                .generatedAt(generatedAt)
                .analysisSuppressed(analysisSuppressed)
                .secondaryDetectorStatus(secondaryDetectorStatus)
                .scanStatus(scanStatus)
                .message(message);
    }

    public String getUnit() {
        return unit;
    }

    public String getPlant() {
        return plant;
    }

    public OperatingState getOperatingState() {
        return operatingState;
    }

    public StateAssessment getStateAssessment() {
        return stateAssessment;
    }

    /**
     * @return tag summaries keyed by tag, iterating in ranked order
     */
    public Map<String, TagAnomalySummary> getTagSummaries() {
        return tagSummaries;
    }

    /**
     * @return summaries in ranked order
     */
    public List<TagAnomalySummary> rankedSummaries() {
        return List.copyOf(tagSummaries.values());
    }

    public UnitTotals getTotals() {
        return totals;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public boolean isAnalysisSuppressed() {
        return analysisSuppressed;
    }

    /** @return status of the reconstruction detector, {@code null} when it was not evaluated */
    public DetectorStatus getSecondaryDetectorStatus() {
        return secondaryDetectorStatus;
    }

    public ScanStatus getScanStatus() {
        return scanStatus;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof UnitAnomalyReport that))
            return false;
        return analysisSuppressed == that.analysisSuppressed
                && unit.equals(that.unit)
                && Objects.equals(plant, that.plant)
                && stateAssessment.equals(that.stateAssessment)
                // ranked order is part of the report
                && List.copyOf(tagSummaries.entrySet()).equals(List.copyOf(that.tagSummaries.entrySet()))
                && totals.equals(that.totals)
                && generatedAt.equals(that.generatedAt)
                && Objects.equals(secondaryDetectorStatus, that.secondaryDetectorStatus)
                && scanStatus == that.scanStatus
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, plant, stateAssessment, tagSummaries, totals, generatedAt,
                analysisSuppressed, secondaryDetectorStatus, scanStatus, message);
    }

    @Override
    public String toString() {
        return "UnitAnomalyReport{unit='" + unit + "', state=" + operatingState
                + ", scanStatus=" + scanStatus + ", suppressed=" + analysisSuppressed
                + ", totals=" + totals + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private final String unit;
        private String plant;
        private StateAssessment stateAssessment = StateAssessment.unknown(null);
        private final Map<String, TagAnomalySummary> tagSummaries = new LinkedHashMap<>();
        private UnitTotals totals = UnitTotals.empty();
        private Instant generatedAt;
        private boolean analysisSuppressed;
        private DetectorStatus secondaryDetectorStatus;
        private ScanStatus scanStatus = ScanStatus.COMPLETED;
        private String message;

        private Builder(String unit) {
            this.unit = unit;
        }

        public Builder plant(String v) {
            this.plant = v;
            return this;
        }

        public Builder stateAssessment(StateAssessment v) {
            this.stateAssessment = v;
            return this;
        }

        /**
         * @param ranked summaries in ranked order
         */
        public Builder tagSummaries(List<TagAnomalySummary> ranked) {
            this.tagSummaries.clear();
            for (TagAnomalySummary summary : ranked) {
                this.tagSummaries.put(summary.getTag(), summary);
            }
            return this;
        }

        public Builder totals(UnitTotals v) {
            this.totals = v;
            return this;
        }

        public Builder generatedAt(Instant v) {
            this.generatedAt = v;
            return this;
        }

        public Builder analysisSuppressed(boolean v) {
            this.analysisSuppressed = v;
            return this;
        }

        public Builder secondaryDetectorStatus(DetectorStatus v) {
            this.secondaryDetectorStatus = v;
            return this;
        }

        public Builder scanStatus(ScanStatus v) {
            this.scanStatus = v;
            return this;
        }

        public Builder message(String v) {
            this.message = v;
            return this;
        }

        public UnitAnomalyReport build() {
            return new UnitAnomalyReport(this);
        }
    }
}
