package com.example.anchormud.combat;

/**
 * Minor actions: at most one per combatant per round.
 */
public enum MinorAction {
    ADVANCE,
    RETREAT,
    READY,
    INTERACT
}
