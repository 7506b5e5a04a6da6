package com.turbosentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Counters over all tag summaries of a unit report.
 *
 * @since 1.0.0
 */
public final class UnitTotals implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int tags;
    private final int analyzed;
    private final int skipped;
    private final int candidates;
    private final int confirmed;
    private final int actionable;

    public UnitTotals(int tags, int analyzed, int skipped, int candidates, int confirmed, int actionable) {
        this.tags = tags;
        this.analyzed = analyzed;
        this.skipped = skipped;
        this.candidates = candidates;
        this.confirmed = confirmed;
        this.actionable = actionable;
    }

    public static UnitTotals empty() {
        return new UnitTotals(0, 0, 0, 0, 0, 0);
    }

    public int getTags() {
        return tags;
    }

    public int getAnalyzed() {
        return analyzed;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getCandidates() {
        return candidates;
    }

    public int getConfirmed() {
        return confirmed;
    }

    public int getActionable() {
        return actionable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof UnitTotals that))
            return false;
        return tags == that.tags && analyzed == that.analyzed && skipped == that.skipped
                && candidates == that.candidates && confirmed == that.confirmed
                && actionable == that.actionable;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tags, analyzed, skipped, candidates, confirmed, actionable);
    }

    @Override
    public String toString() {
        return "UnitTotals{tags=" + tags + ", analyzed=" + analyzed + ", skipped=" + skipped
                + ", candidates=" + candidates + ", confirmed=" + confirmed
                + ", actionable=" + actionable + '}';
    }
}
