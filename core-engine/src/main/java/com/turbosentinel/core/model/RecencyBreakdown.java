package com.turbosentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Verified anomalies of one tag bucketed by age relative to the analysis
 * instant. Buckets are disjoint: an anomaly counted in {@code last24h} is not
 * also counted in {@code last7d}.
 *
 * @since 1.0.0
 */
public final class RecencyBreakdown implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final RecencyBreakdown EMPTY = new RecencyBreakdown(0, 0, 0, 0);

    private final int last24h;
    private final int last7d;
    private final int last30d;
    private final int older;

    public RecencyBreakdown(int last24h, int last7d, int last30d, int older) {
        if (last24h < 0 || last7d < 0 || last30d < 0 || older < 0) {
            throw new IllegalArgumentException("Recency counts must be >= 0");
        }
        this.last24h = last24h;
        this.last7d = last7d;
        this.last30d = last30d;
        this.older = older;
    }

    public static RecencyBreakdown empty() {
        return EMPTY;
    }

    public int getLast24h() {
        return last24h;
    }

    public int getLast7d() {
        return last7d;
    }

    public int getLast30d() {
        return last30d;
    }

    public int getOlder() {
        return older;
    }

    public int total() {
        return last24h + last7d + last30d + older;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecencyBreakdown that))
            return false;
        return last24h == that.last24h && last7d == that.last7d
                && last30d == that.last30d && older == that.older;
    }

    @Override
    public int hashCode() {
        return Objects.hash(last24h, last7d, last30d, older);
    }

    @Override
    public String toString() {
        return "RecencyBreakdown{24h=" + last24h + ", 7d=" + last7d
                + ", 30d=" + last30d + ", older=" + older + '}';
    }
}
