package com.turbosentinel.core.model;

import com.turbosentinel.core.SeriesFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SensorSeries} and {@link SensorSample}.
 */
class SensorSeriesTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Should reject samples that are not strictly increasing")
    void shouldRejectOutOfOrderSamples() {
        List<SensorSample> samples = List.of(
                SensorSample.of("T1", T0.plusSeconds(60), 1.0),
                SensorSample.of("T1", T0, 2.0));

        assertThatThrownBy(() -> new SensorSeries("T1", "U1", samples))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not strictly increasing");
    }

    @Test
    @DisplayName("Should reject duplicate timestamps")
    void shouldRejectDuplicateTimestamps() {
        List<SensorSample> samples = List.of(
                SensorSample.of("T1", T0, 1.0),
                SensorSample.of("T1", T0, 2.0));

        assertThatThrownBy(() -> new SensorSeries("T1", "U1", samples))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject samples of another tag")
    void shouldRejectForeignTag() {
        assertThatThrownBy(() -> new SensorSeries("T1", "U1", List.of(SensorSample.of("T2", T0, 1.0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("T2");
    }

    @Test
    @DisplayName("Should reject non-finite values")
    void shouldRejectNonFiniteValue() {
        assertThatThrownBy(() -> SensorSample.of("T1", T0, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should locate samples by time")
    void shouldLocateSamplesByTime() {
        SensorSeries series = SeriesFixtures.normal("T1", 10, Duration.ofMinutes(10), T0.plus(Duration.ofMinutes(90)), 50);

        assertThat(series.indexAtOrAfter(T0)).isZero();
        assertThat(series.indexAtOrAfter(T0.plusSeconds(1))).isEqualTo(1);
        assertThat(series.indexAtOrAfter(T0.plus(Duration.ofDays(1)))).isEqualTo(10);
        assertThat(series.nearestIndex(T0.plus(Duration.ofMinutes(14)))).isEqualTo(1);
        assertThat(series.nearestIndex(T0.plus(Duration.ofMinutes(16)))).isEqualTo(2);
        assertThat(series.nearestIndex(T0.minus(Duration.ofDays(1)))).isZero();
    }

    @Test
    @DisplayName("Should slice with inclusive start and exclusive end")
    void shouldSliceHalfOpen() {
        SensorSeries series = SeriesFixtures.normal("T1", 10, Duration.ofMinutes(10), T0.plus(Duration.ofMinutes(90)), 50);

        SensorSeries slice = series.slice(T0.plus(Duration.ofMinutes(20)), T0.plus(Duration.ofMinutes(50)));

        assertThat(slice.size()).isEqualTo(3);
        assertThat(slice.timestampAt(0)).isEqualTo(T0.plus(Duration.ofMinutes(20)));
        assertThat(series.latest()).contains(series.getSamples().get(9));
        assertThat(SensorSeries.empty("T1", "U1").latest()).isEmpty();
    }
}
