package com.example.anchormud.world;

import com.example.anchormud.model.EntityInstance;
import com.example.anchormud.model.RoomState;
import com.example.anchormud.util.GameClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds at most one {@link RoomState} per room, created lazily on first
 * relevant interaction and discarded once the room is empty and idle.
 */
public class RoomStateManager {
    private static final Logger logger = LoggerFactory.getLogger(RoomStateManager.class);

    private static final long SEED_MODULUS = 1L << 31;

    private final GameClock clock;
    private final EntityRegistry registry;
    private final long idleHorizonMillis;
    private final long resetIntervalMillis;
    private final Map<String, RoomState> states = new ConcurrentHashMap<>();

    public RoomStateManager(GameClock clock, EntityRegistry registry, long idleHorizonMillis, long resetIntervalMillis) {
        this.clock = clock;
        this.registry = registry;
        this.idleHorizonMillis = idleHorizonMillis;
        this.resetIntervalMillis = resetIntervalMillis;
    }

    /**
     * The room's state, created if missing, with its activity stamp refreshed.
     */
    public RoomState getOrCreate(String roomId) {
        long now = clock.nowMillis();
        RoomState state = states.computeIfAbsent(roomId, id -> {
            long seed = (now / 1000L) % SEED_MODULUS;
            logger.debug("[RoomStateManager] Created state for {} (seed {})", id, seed);
            return new RoomState(id, seed, now, resetIntervalMillis);
        });
        state.touch(now);
        return state;
    }

    /**
     * Existing state or null. Does not create or touch.
     */
    public RoomState get(String roomId) {
        return states.get(roomId);
    }

    public Collection<RoomState> all() {
        return Collections.unmodifiableCollection(states.values());
    }

    /**
     * Refresh the seed and reset window when the reset time has passed.
     * Caller holds the room lock.
     * @return true if the room was reset
     */
    public boolean maybeReset(String roomId) {
        RoomState state = getOrCreate(roomId);
        long now = clock.nowMillis();
        if (now < state.getNextResetAt()) return false;
        long newSeed = (state.getSeed() * 31 + now / 1000L) % SEED_MODULUS;
        state.reset(newSeed, now, resetIntervalMillis);
        logger.debug("[RoomStateManager] Reset {} (new seed {})", roomId, newSeed);
        return true;
    }

    /**
     * Whether the room has no players, no unexpired entities and has been idle past the horizon.
     */
    public boolean isIdle(RoomState state, long nowMillis) {
        if (nowMillis - state.getLastActiveAt() < idleHorizonMillis) return false;
        if (registry.hasPlayers(state.getRoomId())) return false;
        for (EntityInstance inst : registry.instancesInRoom(state.getRoomId())) {
            if (!inst.isExpired(nowMillis)) return false;
        }
        return true;
    }

    /**
     * Discard the room's state if it is idle. Caller holds the room lock.
     * @return true if the state was removed
     */
    public boolean removeIfIdle(String roomId) {
        RoomState state = states.get(roomId);
        if (state == null) return false;
        if (!isIdle(state, clock.nowMillis())) return false;
        boolean removed = states.remove(roomId, state);
        if (removed) {
            logger.debug("[RoomStateManager] Discarded idle state for {}", roomId);
        }
        return removed;
    }

    public int size() {
        return states.size();
    }
}
