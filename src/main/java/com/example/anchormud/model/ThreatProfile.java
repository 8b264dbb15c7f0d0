package com.example.anchormud.model;

/**
 * How a creature picks its next target among valid hostiles.
 */
public enum ThreatProfile {
    /** Most accumulated damage dealt to this creature; ties go to the earliest attacker. */
    DAMAGE,
    /** Whoever struck first and is still valid. */
    FIRST_STRIKE;

    public static ThreatProfile fromString(String str) {
        if (str == null || str.isBlank()) return DAMAGE;
        try {
            return ThreatProfile.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return DAMAGE;
        }
    }
}
