package com.turbosentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable YAML mapping of one entry of the {@code units:} list.
 *
 * <pre>
 * units:
 *   - unit: GT-101
 *     plant: North
 *     speedTags: [GT-101.SPEED]
 *     nominalSpeed: 3600
 *     featureTags: [GT-101.BRG1_TEMP, GT-101.BRG2_TEMP, GT-101.VIB_X]
 *     limits:
 *       GT-101.BRG1_TEMP:
 *         upperLimit: 110
 * </pre>
 *
 * @since 1.0.0
 */
public class UnitSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String unit;
    private String plant;
    private List<String> speedTags = new ArrayList<>();
    private Double nominalSpeed;
    private List<String> featureTags = new ArrayList<>();
    private List<String> monitoredTags = new ArrayList<>();
    private Map<String, TagLimitSettings> limits = new LinkedHashMap<>();

    /**
     * @return immutable profile
     * @throws com.turbosentinel.core.error.ConfigurationException if the unit
     *         name, speed tags or nominal speed are invalid
     */
    public UnitProfile toUnitProfile() {
        UnitProfile.Builder b = UnitProfile.builder(unit)
                .plant(plant)
                .speedTags(speedTags)
                .nominalSpeed(nominalSpeed)
                .featureTags(featureTags)
                .monitoredTags(monitoredTags);
        limits.forEach((tag, settings) -> b.tagLimits(tag,
                settings != null ? settings.toTagLimits() : TagLimits.none()));
        return b.build();
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public String getPlant() {
        return plant;
    }

    public void setPlant(String plant) {
        this.plant = plant;
    }

    public List<String> getSpeedTags() {
        return speedTags;
    }

    public void setSpeedTags(List<String> speedTags) {
        this.speedTags = speedTags != null ? new ArrayList<>(speedTags) : new ArrayList<>();
    }

    public Double getNominalSpeed() {
        return nominalSpeed;
    }

    public void setNominalSpeed(Double nominalSpeed) {
        this.nominalSpeed = nominalSpeed;
    }

    public List<String> getFeatureTags() {
        return featureTags;
    }

    public void setFeatureTags(List<String> featureTags) {
        this.featureTags = featureTags != null ? new ArrayList<>(featureTags) : new ArrayList<>();
    }

    public List<String> getMonitoredTags() {
        return monitoredTags;
    }

    public void setMonitoredTags(List<String> monitoredTags) {
        this.monitoredTags = monitoredTags != null ? new ArrayList<>(monitoredTags) : new ArrayList<>();
    }

    public Map<String, TagLimitSettings> getLimits() {
        return limits;
    }

    public void setLimits(Map<String, TagLimitSettings> limits) {
        this.limits = limits != null ? new LinkedHashMap<>(limits) : new LinkedHashMap<>();
    }
}
