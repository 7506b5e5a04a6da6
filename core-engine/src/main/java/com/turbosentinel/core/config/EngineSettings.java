package com.turbosentinel.core.config;

import com.turbosentinel.core.error.ConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <pre>
 * detection:
 *   primarySigmaThreshold: 2.5
 * units:
 *   - unit: GT-101
 *     speedTags: [GT-101.SPEED]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. It converts every section and
 * reports all problems in a single exception.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectionSettings detection = new DetectionSettings();
    private List<UnitSettings> units = new ArrayList<>();

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    /**
     * @return unmodifiable list of unit settings
     */
    public List<UnitSettings> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public void setUnits(List<UnitSettings> units) {
        this.units = units != null ? new ArrayList<>(units) : new ArrayList<>();
    }

    public DetectionConfig toDetectionConfig() {
        return detection.toDetectionConfig();
    }

    public List<UnitProfile> toUnitProfiles() {
        return units.stream().map(UnitSettings::toUnitProfile).toList();
    }

    /**
     * Validate the detection section and every unit.
     *
     * @throws ConfigurationException if one or more sections are invalid or
     *                                a unit name is repeated
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            detection.toDetectionConfig();
        } catch (ConfigurationException e) {
            errors.add(e.getMessage());
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < units.size(); i++) {
            UnitSettings settings = units.get(i);
            if (settings == null) {
                errors.add("Unit at index " + i + " is null");
                continue;
            }
            try {
                settings.toUnitProfile();
            } catch (ConfigurationException e) {
                errors.add(e.getMessage());
            }
            if (settings.getUnit() != null && !names.add(settings.getUnit())) {
                errors.add("Duplicate unit '" + settings.getUnit() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Engine configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{units=" + units.size() + '}';
    }
}
