package com.example.anchormud.model;

/**
 * How far a hostile creature will chase a combatant that leaves its room.
 * The leash defaults apply when a template does not override them.
 */
public enum PursuitMode {
    NONE("none", 0, 0),
    SHORT("short", 1, 30),
    LONG("long", 3, 120);

    private final String key;
    private final int defaultLeashRooms;
    private final int defaultLeashSeconds;

    PursuitMode(String key, int defaultLeashRooms, int defaultLeashSeconds) {
        this.key = key;
        this.defaultLeashRooms = defaultLeashRooms;
        this.defaultLeashSeconds = defaultLeashSeconds;
    }

    public String getKey() { return key; }

    public int getDefaultLeashRooms() { return defaultLeashRooms; }

    public int getDefaultLeashSeconds() { return defaultLeashSeconds; }

    public static PursuitMode fromString(String str) {
        if (str == null || str.isBlank()) return NONE;
        for (PursuitMode m : values()) {
            if (m.key.equalsIgnoreCase(str.trim())) return m;
        }
        return NONE;
    }
}
