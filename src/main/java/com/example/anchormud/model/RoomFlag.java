package com.example.anchormud.model;

/**
 * Flags that can be applied to rooms to modify runtime behavior.
 *
 * Multiple flags can be applied to a single room.
 */
public enum RoomFlag {
    /**
     * No combat is permitted in this room.
     * Aggressive creatures will not engage and attack intents are rejected.
     * Pursuers never follow into a safe room.
     */
    SAFE("safe", "No combat is permitted in this room"),

    /**
     * Hostile creatures never follow a fleeing combatant into or out of this room,
     * regardless of their pursuit tag.
     */
    NO_PURSUIT("no_pursuit", "Creatures cannot pursue into or out of this room"),

    /**
     * Creatures cannot enter this room by pursuit or wandering.
     */
    NO_MOB("no_mob", "Creatures cannot enter this room by normal movement"),

    /**
     * Room does not run spawn or loot rules while flagged.
     */
    NO_SPAWN("no_spawn", "Spawn and loot rules are suspended");

    private final String key;
    private final String description;

    RoomFlag(String key, String description) {
        this.key = key;
        this.description = description;
    }

    /**
     * Get the content key for this flag.
     */
    public String getKey() {
        return key;
    }

    /**
     * Get a human-readable description of this flag.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Parse a flag from its key (case-insensitive).
     * @return the matching flag, or null if not found
     */
    public static RoomFlag fromKey(String key) {
        if (key == null) return null;
        String lower = key.trim().toLowerCase();
        for (RoomFlag flag : values()) {
            if (flag.key.equals(lower)) return flag;
        }
        return null;
    }
}
