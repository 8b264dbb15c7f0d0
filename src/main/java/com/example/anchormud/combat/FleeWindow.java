package com.example.anchormud.combat;

import java.util.List;

/**
 * Granted by a successful disengage: until {@code untilMillis} the combatant
 * may leave {@code roomId} without another check.
 *
 * @param opponents refs that were fighting the combatant when it broke away
 */
public record FleeWindow(String ref, String roomId, long untilMillis, List<String> opponents) {

    public FleeWindow {
        opponents = List.copyOf(opponents);
    }

    public boolean isOpen(long nowMillis) {
        return nowMillis < untilMillis;
    }
}
