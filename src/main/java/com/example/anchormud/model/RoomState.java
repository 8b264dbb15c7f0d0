package com.example.anchormud.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-room runtime record: seed, spawn and loot timers, active encounter ids
 * and activity timestamps. All times are world millis.
 *
 * Timer consumption is a compare-and-set on an immutable {@link RuleTimer},
 * so two racing callers can never both fire a rule in one cooldown window.
 */
public class RoomState {

    private final String roomId;
    private volatile long seed;
    private volatile long lastActiveAt;
    private volatile long nextResetAt;
    private final AtomicLong lastEncounterRollAt = new AtomicLong(Long.MIN_VALUE);
    private final Map<String, AtomicReference<RuleTimer>> spawnTimers = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<RuleTimer>> lootTimers = new ConcurrentHashMap<>();
    private final Set<String> activeEncounters = ConcurrentHashMap.newKeySet();

    public RoomState(String roomId, long seed, long nowMillis, long resetIntervalMillis) {
        this.roomId = roomId;
        this.seed = seed;
        this.lastActiveAt = nowMillis;
        this.nextResetAt = nowMillis + resetIntervalMillis;
    }

    public String getRoomId() { return roomId; }
    public long getSeed() { return seed; }
    public long getLastActiveAt() { return lastActiveAt; }
    public long getNextResetAt() { return nextResetAt; }

    public void touch(long nowMillis) {
        if (nowMillis > lastActiveAt) lastActiveAt = nowMillis;
    }

    /**
     * Refresh the seed and the reset window. Timers and alive counts survive:
     * live instances still count against their ceilings.
     */
    public void reset(long newSeed, long nowMillis, long resetIntervalMillis) {
        this.seed = newSeed;
        this.nextResetAt = nowMillis + resetIntervalMillis;
    }

    // ========== Spawn / loot timers ==========

    public RuleTimer spawnTimer(String ruleId) {
        AtomicReference<RuleTimer> ref = spawnTimers.get(ruleId);
        return ref == null ? RuleTimer.FRESH : ref.get();
    }

    public RuleTimer lootTimer(String ruleId) {
        AtomicReference<RuleTimer> ref = lootTimers.get(ruleId);
        return ref == null ? RuleTimer.FRESH : ref.get();
    }

    /**
     * Atomically claim up to {@code wanted} slots of a spawn rule.
     * @return number of slots claimed, 0 if the rule is not eligible
     */
    public int tryConsumeSpawn(String ruleId, long nowMillis, long cooldownMillis, int maxAlive, int wanted) {
        return tryConsume(spawnTimers, ruleId, nowMillis, cooldownMillis, maxAlive, wanted);
    }

    public int tryConsumeLoot(String ruleId, long nowMillis, long cooldownMillis, int maxAlive, int wanted) {
        return tryConsume(lootTimers, ruleId, nowMillis, cooldownMillis, maxAlive, wanted);
    }

    public void releaseSpawn(String ruleId, int count) {
        release(spawnTimers, ruleId, count);
    }

    public void releaseLoot(String ruleId, int count) {
        release(lootTimers, ruleId, count);
    }

    private static int tryConsume(Map<String, AtomicReference<RuleTimer>> timers, String ruleId,
                                  long now, long cooldown, int maxAlive, int wanted) {
        AtomicReference<RuleTimer> ref = timers.computeIfAbsent(ruleId, k -> new AtomicReference<>(RuleTimer.FRESH));
        while (true) {
            RuleTimer current = ref.get();
            if (!current.eligible(now, maxAlive)) {
                return 0;
            }
            int granted = Math.max(1, Math.min(wanted, maxAlive - current.alive()));
            if (ref.compareAndSet(current, current.fired(now, cooldown, granted))) {
                return granted;
            }
        }
    }

    private static void release(Map<String, AtomicReference<RuleTimer>> timers, String ruleId, int count) {
        if (ruleId == null || count <= 0) return;
        AtomicReference<RuleTimer> ref = timers.get(ruleId);
        if (ref == null) return;
        ref.updateAndGet(t -> t.released(count));
    }

    // ========== Encounters ==========

    /**
     * Claim the right to roll a random encounter if the cooldown has passed.
     */
    public boolean tryClaimEncounterRoll(long nowMillis, long cooldownMillis) {
        while (true) {
            long last = lastEncounterRollAt.get();
            if (last != Long.MIN_VALUE && nowMillis - last < cooldownMillis) {
                return false;
            }
            if (lastEncounterRollAt.compareAndSet(last, nowMillis)) {
                return true;
            }
        }
    }

    public void addEncounter(String encounterId) {
        activeEncounters.add(encounterId);
    }

    public void removeEncounter(String encounterId) {
        activeEncounters.remove(encounterId);
    }

    public Set<String> getActiveEncounters() {
        return Collections.unmodifiableSet(activeEncounters);
    }
}
