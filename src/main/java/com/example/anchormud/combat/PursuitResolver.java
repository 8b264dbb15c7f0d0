package com.example.anchormud.combat;

import com.example.anchormud.model.BehaviorProfile;
import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.RoomFlag;

/**
 * Decides whether a hostile creature follows a combatant leaving its room.
 *
 * A creature follows only if its pursuit tag allows it, neither room blocks
 * pursuit, the destination admits creatures, and one more room keeps it
 * inside its leash radius and time.
 */
public class PursuitResolver {

    public enum Verdict {
        FOLLOWS,
        STAYS,
        RETURNS_HOME
    }

    public record Decision(CombatantInstance pursuer, Verdict verdict, String reason) {}

    public Decision evaluate(CombatantInstance pursuer, Room from, Room to, long nowMillis) {
        if (pursuer.isDead()) {
            return new Decision(pursuer, Verdict.STAYS, "dead");
        }
        BehaviorProfile behavior = pursuer.getBehavior();
        if (!behavior.pursues()) {
            return new Decision(pursuer, Verdict.STAYS, "does not pursue");
        }
        if (from.hasFlag(RoomFlag.NO_PURSUIT) || to.hasFlag(RoomFlag.NO_PURSUIT)) {
            return new Decision(pursuer, Verdict.STAYS, "pursuit blocked by room");
        }
        if (to.hasFlag(RoomFlag.SAFE) || to.hasFlag(RoomFlag.NO_MOB)) {
            return new Decision(pursuer, Verdict.STAYS, "destination closed to creatures");
        }
        if (!withinLeash(pursuer, behavior, to, nowMillis)) {
            boolean away = !from.getId().equals(pursuer.getOriginRoomId());
            return new Decision(pursuer, away ? Verdict.RETURNS_HOME : Verdict.STAYS, "leash");
        }
        return new Decision(pursuer, Verdict.FOLLOWS, "pursuing");
    }

    static boolean withinLeash(CombatantInstance pursuer, BehaviorProfile behavior, Room to, long nowMillis) {
        if (to.getId().equals(pursuer.getOriginRoomId())) {
            return true;
        }
        int rooms = pursuer.isPursuing() ? pursuer.getPursuitRooms() : 0;
        if (rooms + 1 > behavior.leashRooms()) {
            return false;
        }
        if (pursuer.isPursuing()) {
            long elapsed = nowMillis - pursuer.getPursuitStartedAt();
            return elapsed <= behavior.leashSeconds() * 1000L;
        }
        return true;
    }

    /**
     * Whether a pursuing creature has run out of leash time.
     */
    public static boolean leashExpired(CombatantInstance pursuer, long nowMillis) {
        if (!pursuer.isPursuing()) return false;
        return nowMillis - pursuer.getPursuitStartedAt() > pursuer.getBehavior().leashSeconds() * 1000L;
    }
}
