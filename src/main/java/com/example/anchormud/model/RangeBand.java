package com.example.anchormud.model;

/**
 * Distance band between a combatant and the fight in its room.
 * Melee attacks need ENGAGED; ranged attacks work from any band.
 */
public enum RangeBand {
    ENGAGED("engaged"),
    NEAR("near"),
    FAR("far");

    private final String displayName;

    RangeBand(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** One step closer to the fight, or this band if already engaged. */
    public RangeBand closer() {
        return this == FAR ? NEAR : ENGAGED;
    }

    /** One step away from the fight, or this band if already far. */
    public RangeBand farther() {
        return this == ENGAGED ? NEAR : FAR;
    }
}
