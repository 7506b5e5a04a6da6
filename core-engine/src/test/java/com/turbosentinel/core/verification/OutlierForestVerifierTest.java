package com.turbosentinel.core.verification;

import com.turbosentinel.core.SeriesFixtures;
import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.TagLimits;
import com.turbosentinel.core.error.DetectorUnavailableException;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.SensorSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.turbosentinel.core.SeriesFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link OutlierForestVerifier}.
 */
class OutlierForestVerifierTest {

    private OutlierForestVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new OutlierForestVerifier(DetectionConfig.builder().forestTrees(30).build());
    }

    @Test
    @DisplayName("Should confirm extreme readings and score every candidate")
    void shouldConfirmSpikes() {
        SensorSeries series = SeriesFixtures.withSpikes(
                SeriesFixtures.normal("T1", 300, Duration.ofMinutes(10), AS_OF, 100), 295, 5, 130);
        List<DetectionCandidate> candidates = candidates(series, 295, 5);

        VerifierResult result = verify(series, candidates);

        assertThat(result.getDetector()).isEqualTo(DetectorKind.OUTLIER_FOREST);
        assertThat(result.getConfirmed()).isNotEmpty();
        assertThat(result.getScores()).hasSize(5);
    }

    @Test
    @DisplayName("Should be deterministic for a fixed seed")
    void shouldBeDeterministic() {
        SensorSeries series = SeriesFixtures.withSpikes(
                SeriesFixtures.normal("T1", 300, Duration.ofMinutes(10), AS_OF, 100), 295, 5, 130);
        List<DetectionCandidate> candidates = candidates(series, 295, 5);

        VerifierResult first = verify(series, candidates);
        VerifierResult second = verify(series, candidates);

        assertThat(second.getConfirmed()).isEqualTo(first.getConfirmed());
        assertThat(second.getScores()).isEqualTo(first.getScores());
    }

    @Test
    @DisplayName("Should be unavailable for short series")
    void shouldRejectShortSeries() {
        SensorSeries series = SeriesFixtures.normal("T1", 20, Duration.ofMinutes(10), AS_OF, 100);

        assertThatThrownBy(() -> verify(series, candidates(series, 19, 1)))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("outlier forest needs 30");
    }

    @Test
    @DisplayName("Should produce five standardised features per sample")
    void shouldBuildFeatures() {
        double[][] features = OutlierForestVerifier.features(new double[] {1, 2, 3, 4, 5, 6, 7, 8});

        assertThat(features).hasNumberOfRows(8);
        assertThat(features[0]).hasSize(5);
        double sum = 0.0;
        for (double[] row : features) {
            sum += row[0];
        }
        assertThat(sum).isCloseTo(0.0, within(1e-9));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private VerifierResult verify(SensorSeries series, List<DetectionCandidate> candidates) {
        return verifier.verify(new VerificationInput(series, candidates, TagLimits.none()),
                Deadline.start(DetectorKind.OUTLIER_FOREST, Duration.ofSeconds(30)));
    }

    private static List<DetectionCandidate> candidates(SensorSeries series, int from, int count) {
        List<DetectionCandidate> out = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            out.add(new DetectionCandidate("T1", series.timestampAt(i), series.valueAt(i), 10.0,
                    DetectorKind.STATISTICAL, i));
        }
        return out;
    }
}
