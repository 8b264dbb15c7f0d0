package com.example.anchormud.model;

/**
 * Damage types carried by attack profiles and matched by armor reduction.
 */
public enum DamageType {
    SLASHING,
    PIERCING,
    BLUDGEONING,
    COLD,
    FIRE;

    /**
     * Parse a damage type from a string, case-insensitive.
     * Unknown or missing values fall back to BLUDGEONING, the unarmed type.
     */
    public static DamageType fromString(String str) {
        if (str == null || str.isBlank()) return BLUDGEONING;
        try {
            return DamageType.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return BLUDGEONING;
        }
    }
}
