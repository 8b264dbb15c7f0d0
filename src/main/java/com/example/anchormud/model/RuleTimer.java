package com.example.anchormud.model;

/**
 * Timer state for one spawn or loot rule in one room. World millis.
 * Immutable so it can be swapped atomically.
 */
public record RuleTimer(long lastFiredAt, long nextEligibleAt, int alive) {

    public static final RuleTimer FRESH = new RuleTimer(0, 0, 0);

    public boolean eligible(long nowMillis, int maxAlive) {
        return alive < maxAlive && nowMillis >= nextEligibleAt;
    }

    public RuleTimer fired(long nowMillis, long cooldownMillis, int spawned) {
        return new RuleTimer(nowMillis, nowMillis + cooldownMillis, alive + spawned);
    }

    public RuleTimer released(int count) {
        return new RuleTimer(lastFiredAt, nextEligibleAt, Math.max(0, alive - count));
    }
}
