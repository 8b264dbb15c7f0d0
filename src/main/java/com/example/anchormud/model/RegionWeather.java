package com.example.anchormud.model;

/**
 * Immutable snapshot of one region's active weather.
 * Times are world seconds.
 *
 * @param regionId      owning region
 * @param weather       current type
 * @param intensity     0..3
 * @param startedAt     world second the type became active
 * @param nextChangeAt  earliest world second a new type may be rolled
 * @param seed          per-region seed recorded for diagnostics
 */
public record RegionWeather(String regionId, Weather weather, int intensity,
                            long startedAt, long nextChangeAt, long seed) {

    public static final int MAX_INTENSITY = 3;

    public RegionWeather {
        if (regionId == null) throw new IllegalArgumentException("regionId is required");
        if (weather == null) weather = Weather.CLEAR;
        intensity = Math.max(0, Math.min(MAX_INTENSITY, intensity));
    }

    /**
     * Scale factor applied to weather modifiers: (intensity + 1) / 4.
     */
    public double intensityScale() {
        return (intensity + 1) / 4.0;
    }

    /**
     * Serialized form for the settings table: type:intensity:startedAt:nextChangeAt:seed
     */
    public String encode() {
        return "%s:%d:%d:%d:%d".formatted(weather.getKey(), intensity, startedAt, nextChangeAt, seed);
    }

    /**
     * Parse the settings form written by {@link #encode()}.
     * @return the snapshot, or null if the value is malformed
     */
    public static RegionWeather decode(String regionId, String value) {
        if (value == null) return null;
        String[] parts = value.split(":");
        if (parts.length != 5) return null;
        try {
            return new RegionWeather(regionId, Weather.fromKey(parts[0]), Integer.parseInt(parts[1]),
                    Long.parseLong(parts[2]), Long.parseLong(parts[3]), Long.parseLong(parts[4]));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
