package com.example.anchormud.combat;

/**
 * Per-combatant state inside a combat session. Exposed, Pinned and Staggered
 * are modifiers layered on top (see {@link com.example.anchormud.model.CombatModifier}).
 */
public enum ParticipantState {
    OBSERVING("observing"),
    ENGAGED("engaged"),
    SUPPORTING("supporting"),
    DISENGAGING("disengaging");

    private final String displayName;

    ParticipantState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Whether this participant keeps the session alive. */
    public boolean isActive() {
        return this != OBSERVING;
    }
}
