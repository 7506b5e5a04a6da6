package com.turbosentinel.core.state;

import com.turbosentinel.core.SeriesFixtures;
import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.SpeedTagAssessment;
import com.turbosentinel.core.model.StateAssessment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.turbosentinel.core.SeriesFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StateClassifier}.
 */
class StateClassifierTest {

    private StateClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new StateClassifier(DetectionConfig.defaults());
    }

    @Test
    @DisplayName("Should classify SHUTDOWN when most speed readings are near zero")
    void shouldDetectShutdown() {
        double[] speeds = new double[20];
        Arrays.fill(speeds, 0, 18, 2.0);
        Arrays.fill(speeds, 18, 20, 3000.0);

        StateAssessment state = classify(profile(null), speeds);

        assertThat(state.getState()).isEqualTo(OperatingState.SHUTDOWN);
        SpeedTagAssessment speed = state.getSpeedTags().get(0);
        assertThat(speed.getNearZeroFraction()).isEqualTo(0.9);
        assertThat(speed.getSampleCount()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should classify SHUTDOWN when the most recent readings are near zero")
    void shouldDetectCoastDown() {
        double[] speeds = new double[20];
        Arrays.fill(speeds, 0, 15, 3000.0);
        Arrays.fill(speeds, 15, 20, 0.0);

        assertThat(classify(profile(null), speeds).getState()).isEqualTo(OperatingState.SHUTDOWN);
    }

    @Test
    @DisplayName("Should classify LOW_SPEED relative to the nominal speed")
    void shouldDetectLowSpeedAgainstNominal() {
        double[] speeds = new double[20];
        Arrays.fill(speeds, 1500.0);

        assertThat(classify(profile(3600.0), speeds).getState()).isEqualTo(OperatingState.LOW_SPEED);
        assertThat(classify(profile(null), speeds).getState()).isEqualTo(OperatingState.RUNNING);
    }

    @Test
    @DisplayName("Should classify LOW_SPEED below the absolute floor without a nominal speed")
    void shouldDetectLowSpeedAgainstFloor() {
        double[] speeds = new double[20];
        Arrays.fill(speeds, 30.0);

        assertThat(classify(profile(null), speeds).getState()).isEqualTo(OperatingState.LOW_SPEED);
    }

    @Test
    @DisplayName("Should only look at readings inside the state window")
    void shouldIgnoreOldReadings() {
        double[] speeds = new double[40];
        Arrays.fill(speeds, 0, 20, 0.0);
        Arrays.fill(speeds, 20, 40, 3000.0);

        assertThat(classify(profile(null), speeds).getState()).isEqualTo(OperatingState.RUNNING);
    }

    @Test
    @DisplayName("Should report UNKNOWN without speed tags or recent readings")
    void shouldReportUnknown() {
        UnitProfile noSpeed = UnitProfile.builder("GT-101").build();
        assertThat(classifier.classify(noSpeed, Map.of(), AS_OF).getState()).isEqualTo(OperatingState.UNKNOWN);

        SensorSeries stale = SeriesFixtures.normal("SPEED", 20, Duration.ofMinutes(5), AS_OF.minus(Duration.ofDays(1)), 3000);
        StateAssessment state = classifier.classify(profile(null), Map.of("SPEED", stale), AS_OF);
        assertThat(state.getState()).isEqualTo(OperatingState.UNKNOWN);
        assertThat(state.getMessage()).contains("No recent speed readings");
    }

    @Test
    @DisplayName("Should let any shut-down speed tag win")
    void shouldCombineSpeedTags() {
        double[] running = new double[20];
        Arrays.fill(running, 3000.0);
        double[] stopped = new double[20];
        UnitProfile profile = UnitProfile.builder("GT-101").speedTags(List.of("A", "B")).build();

        StateAssessment state = classifier.classify(profile, Map.of(
                "A", SeriesFixtures.series("A", running, Duration.ofMinutes(5), AS_OF),
                "B", SeriesFixtures.series("B", stopped, Duration.ofMinutes(5), AS_OF)), AS_OF);

        assertThat(state.getState()).isEqualTo(OperatingState.SHUTDOWN);
        assertThat(state.getSpeedTags()).hasSize(2);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private StateAssessment classify(UnitProfile profile, double[] speeds) {
        // five-minute spacing: 24 readings span the two-hour window
        SensorSeries series = SeriesFixtures.series("SPEED", speeds, Duration.ofMinutes(5), AS_OF);
        return classifier.classify(profile, Map.of("SPEED", series), AS_OF);
    }

    private static UnitProfile profile(Double nominal) {
        return UnitProfile.builder("GT-101").speedTags(List.of("SPEED")).nominalSpeed(nominal).build();
    }
}
