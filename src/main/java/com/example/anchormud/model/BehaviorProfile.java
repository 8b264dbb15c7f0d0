package com.example.anchormud.model;

/**
 * Behavioral tags for a combatant template.
 *
 * @param pursuit       pursuit tag
 * @param leashRooms    maximum rooms away from origin while pursuing
 * @param leashSeconds  maximum game seconds spent pursuing
 * @param aggressive    engages players who enter its room
 * @param threat        targeting rule
 */
public record BehaviorProfile(PursuitMode pursuit, int leashRooms, int leashSeconds,
                              boolean aggressive, ThreatProfile threat) {

    public static final BehaviorProfile PASSIVE =
            new BehaviorProfile(PursuitMode.NONE, 0, 0, false, ThreatProfile.DAMAGE);

    public BehaviorProfile {
        if (pursuit == null) pursuit = PursuitMode.NONE;
        if (threat == null) threat = ThreatProfile.DAMAGE;
        if (leashRooms <= 0) leashRooms = pursuit.getDefaultLeashRooms();
        if (leashSeconds <= 0) leashSeconds = pursuit.getDefaultLeashSeconds();
    }

    public boolean pursues() {
        return pursuit != PursuitMode.NONE;
    }
}
