package com.example.anchormud.combat;

/**
 * Represents the current state of a combat session.
 */
public enum CombatState {

    /** Rounds are running */
    ACTIVE("Active"),

    /** No hostile relationship remains; the session is discarded */
    ENDED("Ended");

    private final String displayName;

    CombatState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
