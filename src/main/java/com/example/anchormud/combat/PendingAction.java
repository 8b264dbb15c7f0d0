package com.example.anchormud.combat;

import com.example.anchormud.model.ManeuverDefinition;

/**
 * The primary action a participant has committed to for the current round.
 */
public record PendingAction(Kind kind, String targetRef, ManeuverDefinition maneuver) {

    public enum Kind {
        MANEUVER,
        DISENGAGE
    }

    public static PendingAction maneuver(ManeuverDefinition maneuver, String targetRef) {
        return new PendingAction(Kind.MANEUVER, targetRef, maneuver);
    }

    public static PendingAction disengage() {
        return new PendingAction(Kind.DISENGAGE, null, null);
    }
}
