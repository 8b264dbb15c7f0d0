package com.example.anchormud.combat;

/**
 * How leaving a room interacts with an ongoing fight.
 */
public enum LeaveMode {
    /** Engaged combatants must disengage first; hostile creatures may pursue. */
    DISENGAGE_AND_PURSUIT,
    /** Walking out simply ends your part in the fight; nobody follows. */
    LEAVE_ENDS_COMBAT
}
