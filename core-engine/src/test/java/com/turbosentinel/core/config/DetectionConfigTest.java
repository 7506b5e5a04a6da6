package com.turbosentinel.core.config;

import com.turbosentinel.core.error.ConfigurationException;
import com.turbosentinel.core.model.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfig}, {@link UnitProfile} and
 * {@link TagLimits}.
 */
class DetectionConfigTest {

    @Test
    @DisplayName("Should expose documented defaults")
    void shouldHaveDefaults() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(config.getPrimarySigmaThreshold()).isEqualTo(2.5);
        assertThat(config.getMinConsecutiveRun()).isEqualTo(6);
        assertThat(config.getRecencyWindow()).isEqualTo(Duration.ofHours(24));
        assertThat(config.getBaselineWindow()).isEqualTo(Duration.ofDays(90));
        assertThat(config.getConfidenceStrategy()).isEqualTo(ConfidenceStrategy.FIXED_BUDGET);
        assertThat(config.getShutdownPolicy()).isEqualTo(ShutdownPolicy.SUPPRESS_ANALYSIS);
        assertThat(config.thresholdFor(Priority.CRITICAL)).isEqualTo(50.0);
        assertThat(config.thresholdFor(Priority.LOW)).isEqualTo(80.0);
        assertThat(config.isRequireSecondaryPrimaryDetector()).isFalse();
    }

    @Test
    @DisplayName("Should list every invalid value in one exception")
    void shouldCollectErrors() {
        assertThatThrownBy(() -> DetectionConfig.builder()
                .primarySigmaThreshold(0)
                .minConsecutiveRun(0)
                .shutdownFraction(1.5)
                .workerThreads(0)
                .build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("primarySigmaThreshold")
                .hasMessageContaining("minConsecutiveRun")
                .hasMessageContaining("shutdownFraction")
                .hasMessageContaining("workerThreads");
    }

    @Test
    @DisplayName("Should reject a confidence threshold above 100")
    void shouldRejectThresholdOutOfRange() {
        assertThatThrownBy(() -> DetectionConfig.builder().confidenceThreshold(Priority.HIGH, 120).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("confidenceThresholds.HIGH");
    }

    @Test
    @DisplayName("Should copy every value through toBuilder")
    void shouldRoundTripThroughBuilder() {
        DetectionConfig config = DetectionConfig.builder()
                .primarySigmaThreshold(3.0)
                .confidenceStrategy(ConfidenceStrategy.ADDITIVE)
                .workerThreads(3)
                .build();

        assertThat(config.toBuilder().build()).isEqualTo(config);
    }

    @Test
    @DisplayName("Should reject a blank unit name and a non-positive nominal speed")
    void shouldValidateUnitProfile() {
        assertThatThrownBy(() -> UnitProfile.builder(" ").build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> UnitProfile.builder("GT-101").nominalSpeed(0.0).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nominalSpeed");
    }

    @Test
    @DisplayName("Should check values against hard limits")
    void shouldCheckHardLimits() {
        TagLimits limits = new TagLimits(10.0, 20.0, null);

        assertThat(limits.hasHardLimits()).isTrue();
        assertThat(limits.isOutside(9.9)).isTrue();
        assertThat(limits.isOutside(20.1)).isTrue();
        assertThat(limits.isOutside(15.0)).isFalse();
        assertThat(TagLimits.none().isOutside(1e9)).isFalse();
    }

    @Test
    @DisplayName("Should reject a non-positive sigma override")
    void shouldRejectBadSigmaOverride() {
        assertThatThrownBy(() -> new TagLimits(null, null, -1.0).validate("T1"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sigmaOverride");
    }
}
