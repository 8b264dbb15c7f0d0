package com.example.anchormud.model;

/**
 * Named parts of the in-game day, derived from the hour.
 */
public enum DayPart {
    DAWN("Dawn"),
    MORNING("Morning"),
    AFTERNOON("Afternoon"),
    DUSK("Dusk"),
    NIGHT("Night");

    private final String displayName;

    DayPart(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Dawn 05-08, Morning 08-12, Afternoon 12-17, Dusk 17-20, Night otherwise.
     */
    public static DayPart forHour(int hour) {
        if (hour >= 5 && hour < 8) return DAWN;
        if (hour >= 8 && hour < 12) return MORNING;
        if (hour >= 12 && hour < 17) return AFTERNOON;
        if (hour >= 17 && hour < 20) return DUSK;
        return NIGHT;
    }
}
