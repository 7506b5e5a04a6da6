package com.turbosentinel.core.state;

import com.turbosentinel.core.config.DetectionConfig;
import com.turbosentinel.core.config.UnitProfile;
import com.turbosentinel.core.model.OperatingState;
import com.turbosentinel.core.model.SensorSeries;
import com.turbosentinel.core.model.SpeedTagAssessment;
import com.turbosentinel.core.model.StateAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives a unit's operating state from its configured speed tags.
 *
 * <h3>Per speed tag</h3>
 * <p>
 * Readings in the trailing {@code stateWindow} are evaluated:
 * </p>
 * <ul>
 * <li>{@code SHUTDOWN} when more than {@code shutdownFraction} of them are
 * at or below {@code nearZeroThreshold}, or when the mean of the last five is
 * at or below it;</li>
 * <li>{@code LOW_SPEED} when the mean is positive but below the low-speed
 * floor ({@code nominalSpeed * lowSpeedRatio}, or {@code lowSpeedFloor} when
 * no nominal speed is configured);</li>
 * <li>{@code RUNNING} otherwise.</li>
 * </ul>
 *
 * <h3>Per unit</h3>
 * <p>
 * Any SHUTDOWN wins, then any LOW_SPEED, then RUNNING. Without a configured
 * speed tag or without recent speed readings the state is {@code UNKNOWN}.
 * </p>
 *
 * @since 1.0.0
 */
public class StateClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(StateClassifier.class);

    static final int RECENT_READINGS = 5;

    private final DetectionConfig config;

    public StateClassifier(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * @param profile     unit profile naming the speed tags
     * @param seriesByTag series of the unit, keyed by tag; speed tags missing
     *                    from the map count as having no recent readings
     * @param asOf        analysis instant
     * @return unit operating state with per-speed-tag evidence
     */
    public StateAssessment classify(UnitProfile profile, Map<String, SensorSeries> seriesByTag, Instant asOf) {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(seriesByTag, "seriesByTag must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");

        if (profile.getSpeedTags().isEmpty()) {
            return StateAssessment.unknown("No speed tag configured for unit " + profile.getUnit());
        }

        double floor = profile.getNominalSpeed().isPresent()
                ? profile.getNominalSpeed().getAsDouble() * config.getLowSpeedRatio()
                : config.getLowSpeedFloor();
        Instant from = asOf.minus(config.getStateWindow());
        Instant to = asOf.plusNanos(1);

        List<SpeedTagAssessment> assessments = new ArrayList<>();
        OperatingState unitState = null;
        for (String tag : profile.getSpeedTags()) {
            SensorSeries series = seriesByTag.get(tag);
            if (series == null) {
                LOG.warn("Unit {}: speed tag '{}' has no series", profile.getUnit(), tag);
                continue;
            }
            SensorSeries window = series.slice(from, to);
            if (window.isEmpty()) {
                LOG.debug("Unit {}: speed tag '{}' has no readings in the state window", profile.getUnit(), tag);
                continue;
            }
            SpeedTagAssessment assessment = assess(tag, window.values(), floor);
            assessments.add(assessment);
            unitState = unitState == null ? assessment.getState() : unitState.combine(assessment.getState());
        }

        if (unitState == null) {
            return StateAssessment.unknown("No recent speed readings for unit " + profile.getUnit());
        }
        LOG.debug("Unit {} classified as {}", profile.getUnit(), unitState);
        return new StateAssessment(unitState, assessments, describe(unitState, assessments));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    SpeedTagAssessment assess(String tag, double[] speeds, double lowSpeedFloor) {
        int n = speeds.length;
        double threshold = config.getNearZeroThreshold();

        int nearZero = 0;
        double sum = 0.0;
        for (double v : speeds) {
            if (v <= threshold) {
                nearZero++;
            }
            sum += v;
        }
        double mean = sum / n;
        double nearZeroFraction = (double) nearZero / n;

        int recentStart = Math.max(0, n - RECENT_READINGS);
        double recentSum = 0.0;
        for (int i = recentStart; i < n; i++) {
            recentSum += speeds[i];
        }
        double recentMean = recentSum / (n - recentStart);

        OperatingState state;
        if (nearZeroFraction > config.getShutdownFraction() || recentMean <= threshold) {
            state = OperatingState.SHUTDOWN;
        } else if (mean > 0 && mean < lowSpeedFloor) {
            state = OperatingState.LOW_SPEED;
        } else {
            state = OperatingState.RUNNING;
        }
        return new SpeedTagAssessment(tag, state, n, mean, recentMean, nearZeroFraction);
    }

    private static String describe(OperatingState state, List<SpeedTagAssessment> assessments) {
        return switch (state) {
            case SHUTDOWN -> "Unit shut down according to " + tagsIn(OperatingState.SHUTDOWN, assessments);
            case LOW_SPEED -> "Unit at low speed according to " + tagsIn(OperatingState.LOW_SPEED, assessments);
            case RUNNING -> "Unit running";
            case UNKNOWN -> "Operating state unknown";
        };
    }

    private static List<String> tagsIn(OperatingState state, List<SpeedTagAssessment> assessments) {
        return assessments.stream()
                .filter(a -> a.getState() == state)
                .map(SpeedTagAssessment::getTag)
                .toList();
    }
}
