package com.example.anchormud.model;

/**
 * When a readied reaction maneuver fires.
 */
public enum ReactionTrigger {
    NONE,
    /** The holder is attacked in the action phase. */
    ON_ATTACKED,
    /** An engaged opponent of the holder tries to disengage. */
    ON_DISENGAGE;

    public static ReactionTrigger fromString(String str) {
        if (str == null || str.isBlank()) return NONE;
        try {
            return ReactionTrigger.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
