package com.example.anchormud.model;

/**
 * How much of the regional weather a room lets through.
 * Indoor rooms show no overlay and take no weather modifiers.
 */
public enum WeatherExposure {
    INDOOR("indoor"),
    SHELTERED("sheltered"),
    OUTDOOR("outdoor"),
    COASTAL("coastal");

    private final String key;

    WeatherExposure(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isAffected() {
        return this != INDOOR;
    }

    public static WeatherExposure fromKey(String key) {
        if (key == null) return OUTDOOR;
        for (WeatherExposure e : values()) {
            if (e.key.equalsIgnoreCase(key.trim())) return e;
        }
        return OUTDOOR;
    }
}
