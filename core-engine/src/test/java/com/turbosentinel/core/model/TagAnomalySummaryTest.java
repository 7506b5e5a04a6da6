package com.turbosentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TagAnomalySummary}, {@link OperatingState} and
 * {@link FreshnessLevel}.
 */
class TagAnomalySummaryTest {

    @Test
    @DisplayName("Should reject more confirmations than candidates")
    void shouldRejectConfirmedAboveCandidates() {
        assertThatThrownBy(() -> TagAnomalySummary.builder("T1").candidateCount(2).confirmedCount(3).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confirmedCount");
    }

    @Test
    @DisplayName("Should reject a confidence score outside [0, 100]")
    void shouldRejectScoreOutOfRange() {
        assertThatThrownBy(() -> TagAnomalySummary.builder("T1").confidenceScore(100.5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should copy every field through toBuilder")
    void shouldRoundTripThroughBuilder() {
        TagAnomalySummary summary = TagAnomalySummary.builder("T1")
                .candidateCount(5)
                .confirmedCount(2)
                .confidenceScore(60)
                .priority(Priority.CRITICAL)
                .recencyBreakdown(new RecencyBreakdown(2, 0, 0, 0))
                .detectorCount(DetectorKind.STATISTICAL, 5)
                .detectorCount(DetectorKind.TAU_TEST, 2)
                .dataAge(Duration.ofMinutes(5))
                .freshness(FreshnessLevel.FRESH)
                .build();

        assertThat(summary.toBuilder().build()).isEqualTo(summary);
        assertThat(summary.detectorCount(DetectorKind.OUTLIER_FOREST)).isZero();
        assertThat(summary.isSkipped()).isFalse();
    }

    @Test
    @DisplayName("Should let the more restrictive operating state win")
    void shouldCombineOperatingStates() {
        assertThat(OperatingState.RUNNING.combine(OperatingState.SHUTDOWN)).isEqualTo(OperatingState.SHUTDOWN);
        assertThat(OperatingState.LOW_SPEED.combine(OperatingState.RUNNING)).isEqualTo(OperatingState.LOW_SPEED);
        assertThat(OperatingState.UNKNOWN.combine(OperatingState.RUNNING)).isEqualTo(OperatingState.RUNNING);
    }

    @Test
    @DisplayName("Should grade data age into freshness levels")
    void shouldGradeFreshness() {
        Duration staleAfter = Duration.ofHours(24);

        assertThat(FreshnessLevel.of(Duration.ofHours(2), staleAfter)).isEqualTo(FreshnessLevel.FRESH);
        assertThat(FreshnessLevel.of(Duration.ofHours(30), staleAfter)).isEqualTo(FreshnessLevel.MILDLY_STALE);
        assertThat(FreshnessLevel.of(Duration.ofDays(5), staleAfter)).isEqualTo(FreshnessLevel.STALE);
        assertThat(FreshnessLevel.of(Duration.ofDays(30), staleAfter)).isEqualTo(FreshnessLevel.SEVERELY_STALE);
        assertThat(FreshnessLevel.of(null, staleAfter)).isEqualTo(FreshnessLevel.NO_DATA);
    }
}
