package com.example.anchormud.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Regional weather types.
 *
 * Each type carries a change message broadcast on transition and one
 * overlay line per exposure for room rendering.
 */
public enum Weather {
    CLEAR("clear", "Clear", "The weather clears.",
            "The air is still and clear.",
            "The sky is clear beyond shelter.",
            "Clear skies over the water."),
    FOG("fog", "Fog", "Fog rolls in, thickening the air.",
            "A cold fog crawls through, muffling sound and swallowing distant shapes.",
            "Fog drifts past, dimming the world beyond.",
            "Sea fog rolls in, thick and clammy."),
    WIND("wind", "Wind", "The wind rises.",
            "The wind blows steadily, tugging at clothes and foliage.",
            "Wind whistles past your shelter.",
            "Wind whips off the water, sharp and salt-tanged."),
    SQUALL("squall", "Squall", "A squall sweeps in.",
            "A squall drives rain and wind; visibility drops.",
            "A squall batters the world outside.",
            "A squall whips the coast; spray and rain sting."),
    COLD_SNAP("cold_snap", "Cold Snap", "A cold snap descends.",
            "A cold snap bites; breath fogs and fingers numb.",
            "Cold seeps in despite shelter.",
            "Bitter wind off the water cuts through."),
    SALT_RAIN("salt_rain", "Salt Rain", "Salt rain begins to fall.",
            "Salt rain falls, stinging skin and metal.",
            "Salt rain drums beyond shelter.",
            "Salt rain and spray lash the coast.");

    private final String key;
    private final String displayName;
    private final String changeMessage;
    private final Map<WeatherExposure, String> overlays = new EnumMap<>(WeatherExposure.class);

    Weather(String key, String displayName, String changeMessage,
            String outdoor, String sheltered, String coastal) {
        this.key = key;
        this.displayName = displayName;
        this.changeMessage = changeMessage;
        overlays.put(WeatherExposure.OUTDOOR, outdoor);
        overlays.put(WeatherExposure.SHELTERED, sheltered);
        overlays.put(WeatherExposure.COASTAL, coastal);
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Message sent to players in the region when the weather turns to this type.
     */
    public String getChangeMessage() {
        return changeMessage;
    }

    /**
     * Overlay line for a room of the given exposure, or null for indoor rooms.
     */
    public String getOverlay(WeatherExposure exposure) {
        if (exposure == null || !exposure.isAffected()) return null;
        return overlays.get(exposure);
    }

    /**
     * Parse weather from a key. Unknown keys are CLEAR.
     */
    public static Weather fromKey(String key) {
        if (key == null) return CLEAR;
        for (Weather w : values()) {
            if (w.key.equalsIgnoreCase(key.trim())) return w;
        }
        return CLEAR;
    }
}
