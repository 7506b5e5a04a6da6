package com.turbosentinel.core.verification;

import com.turbosentinel.core.SeriesFixtures;
import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.TagLimits;
import com.turbosentinel.core.error.DetectorUnavailableException;
import com.turbosentinel.core.model.DetectionCandidate;
import com.turbosentinel.core.model.DetectorKind;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.VerificationVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.turbosentinel.core.SeriesFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link VerificationLayer}, {@link VerifierFactory} and
 * {@link Deadline}.
 */
class VerificationLayerTest {

    private DetectionConfig config;
    private SensorSeries series;
    private DetectionCandidate first;
    private DetectionCandidate second;

    @BeforeEach
    void setUp() {
        config = DetectionConfig.defaults();
        series = SeriesFixtures.normal("T1", 50, Duration.ofMinutes(10), AS_OF, 100);
        first = candidate(10);
        second = candidate(20);
    }

    @Test
    @DisplayName("Should verify a candidate confirmed by any verifier")
    void shouldCombineWithOr() {
        VerificationLayer layer = new VerificationLayer(config, List.of(
                fixed(DetectorKind.TAU_TEST, Set.of(first.getTimestamp())),
                fixed(DetectorKind.OUTLIER_FOREST, Set.of(second.getTimestamp()))));

        VerificationOutcome outcome = layer.verify(input(first, second));

        assertThat(outcome.getVerdicts()).hasSize(2);
        assertThat(outcome.verified()).extracting(VerificationVerdict::getCandidate).containsExactly(first, second);
        assertThat(outcome.confirmedBy(DetectorKind.TAU_TEST)).isEqualTo(1);
        assertThat(outcome.confirmedBy(DetectorKind.OUTLIER_FOREST)).isEqualTo(1);
        assertThat(outcome.getVerdicts().get(0).getConfirmedBy()).containsExactly(DetectorKind.TAU_TEST);
    }

    @Test
    @DisplayName("Should skip an unavailable verifier and keep the others")
    void shouldSkipUnavailableVerifier() {
        VerificationLayer layer = new VerificationLayer(config, List.of(
                fixed(DetectorKind.TAU_TEST, Set.of(first.getTimestamp())),
                unavailable(DetectorKind.OUTLIER_FOREST)));

        VerificationOutcome outcome = layer.verify(input(first, second));

        assertThat(outcome.verified()).hasSize(1);
        assertThat(outcome.getSkipped()).containsOnlyKeys(DetectorKind.OUTLIER_FOREST);
        assertThat(outcome.getSkipped().get(DetectorKind.OUTLIER_FOREST)).contains("not enough data");
    }

    @Test
    @DisplayName("Should skip a verifier whose model fails and keep the others' confirmations")
    void shouldSkipFailingVerifier() {
        VerificationLayer layer = new VerificationLayer(config, List.of(
                failing(DetectorKind.OUTLIER_FOREST),
                fixed(DetectorKind.TAU_TEST, Set.of(first.getTimestamp()))));

        VerificationOutcome outcome = layer.verify(input(first, second));

        assertThat(outcome.verified()).extracting(VerificationVerdict::getCandidate).containsExactly(first);
        assertThat(outcome.confirmedBy(DetectorKind.TAU_TEST)).isEqualTo(1);
        assertThat(outcome.getSkipped()).containsOnlyKeys(DetectorKind.OUTLIER_FOREST);
        assertThat(outcome.getSkipped().get(DetectorKind.OUTLIER_FOREST))
                .isEqualTo("IllegalArgumentException: forest dimension mismatch");
    }

    @Test
    @DisplayName("Should reject every candidate when no verifier can run")
    void shouldRejectWhenAllUnavailable() {
        VerificationLayer layer = new VerificationLayer(config, List.of(
                unavailable(DetectorKind.TAU_TEST), unavailable(DetectorKind.OUTLIER_FOREST)));

        VerificationOutcome outcome = layer.verify(input(first));

        assertThat(outcome.getVerdicts()).hasSize(1);
        assertThat(outcome.verified()).isEmpty();
        assertThat(outcome.getSkipped()).hasSize(2);
    }

    @Test
    @DisplayName("Should not run verifiers without candidates")
    void shouldShortCircuitWithoutCandidates() {
        AtomicInteger calls = new AtomicInteger();
        Verifier counting = new Verifier() {
            @Override
            public DetectorKind kind() {
                return DetectorKind.TAU_TEST;
            }

            @Override
            public VerifierResult verify(VerificationInput input, Deadline deadline) {
                calls.incrementAndGet();
                return new VerifierResult(kind(), Set.of(), Map.of());
            }
        };

        VerificationOutcome outcome = new VerificationLayer(config, List.of(counting)).verify(input());

        assertThat(outcome.getVerdicts()).isEmpty();
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("Should create one verifier per verification detector")
    void shouldCreateAllVerifiers() {
        assertThat(VerifierFactory.createAll(config))
                .extracting(Verifier::kind)
                .containsExactly(DetectorKind.TAU_TEST, DetectorKind.OUTLIER_FOREST);
        assertThatThrownBy(() -> VerifierFactory.create(DetectorKind.STATISTICAL, config))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report an exhausted time budget as unavailable")
    void shouldExpireDeadline() throws InterruptedException {
        Deadline deadline = Deadline.start(DetectorKind.OUTLIER_FOREST, Duration.ofMillis(1));
        Thread.sleep(20);

        assertThat(deadline.isExpired()).isTrue();
        assertThatThrownBy(deadline::check)
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("time budget");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private VerificationInput input(DetectionCandidate... candidates) {
        return new VerificationInput(series, List.of(candidates), TagLimits.none());
    }

    private DetectionCandidate candidate(int index) {
        return new DetectionCandidate("T1", series.timestampAt(index), series.valueAt(index), 3.0,
                DetectorKind.STATISTICAL, index);
    }

    private static Verifier fixed(DetectorKind kind, Set<Instant> confirmed) {
        return new Verifier() {
            @Override
            public DetectorKind kind() {
                return kind;
            }

            @Override
            public VerifierResult verify(VerificationInput input, Deadline deadline) {
                return new VerifierResult(kind, confirmed, Map.of());
            }
        };
    }

    private static Verifier unavailable(DetectorKind kind) {
        return new Verifier() {
            @Override
            public DetectorKind kind() {
                return kind;
            }

            @Override
            public VerifierResult verify(VerificationInput input, Deadline deadline) {
                throw new DetectorUnavailableException(kind, kind + ": not enough data");
            }
        };
    }

    private static Verifier failing(DetectorKind kind) {
        return new Verifier() {
            @Override
            public DetectorKind kind() {
                return kind;
            }

            @Override
            public VerifierResult verify(VerificationInput input, Deadline deadline) {
                throw new IllegalArgumentException("forest dimension mismatch");
            }
        };
    }
}
