package com.example.anchormud.model;

/**
 * Short-lived combat conditions overlaid on Engaged or Supporting.
 * Each lasts until the end of the next round.
 */
public enum CombatModifier {
    EXPOSED("exposed", 0, -15),
    PINNED("pinned", 0, 0),
    STAGGERED("staggered", -15, 0);

    private final String displayName;
    private final int accuracyModifier;
    private final int avoidanceModifier;

    CombatModifier(String displayName, int accuracyModifier, int avoidanceModifier) {
        this.displayName = displayName;
        this.accuracyModifier = accuracyModifier;
        this.avoidanceModifier = avoidanceModifier;
    }

    public String getDisplayName() { return displayName; }
    public int getAccuracyModifier() { return accuracyModifier; }
    public int getAvoidanceModifier() { return avoidanceModifier; }

    /** Pinned combatants cannot disengage or change band. */
    public boolean blocksMovement() {
        return this == PINNED;
    }

    public static CombatModifier fromString(String str) {
        if (str == null || str.isBlank()) return null;
        try {
            return CombatModifier.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
