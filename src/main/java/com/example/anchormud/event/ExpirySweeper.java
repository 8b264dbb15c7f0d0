package com.example.anchormud.event;

import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.EntityInstance;
import com.example.anchormud.model.ItemInstance;
import com.example.anchormud.model.RoomState;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.SpawnEventLogger;
import com.example.anchormud.world.EntityRegistry;
import com.example.anchormud.world.RoomLockManager;
import com.example.anchormud.world.RoomStateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Removes expired items and unengaged wandering-encounter creatures, and
 * discards room states that have gone idle. Runs on a recurring schedule and
 * lazily whenever a room is entered.
 */
public class ExpirySweeper {
    private static final Logger logger = LoggerFactory.getLogger(ExpirySweeper.class);

    private final GameClock clock;
    private final EntityRegistry registry;
    private final RoomStateManager rooms;
    private final RoomLockManager locks;
    private final SpawnService spawnService;
    private volatile Predicate<String> engaged = ref -> false;

    public ExpirySweeper(GameClock clock, EntityRegistry registry, RoomStateManager rooms,
                         RoomLockManager locks, SpawnService spawnService) {
        this.clock = clock;
        this.registry = registry;
        this.rooms = rooms;
        this.locks = locks;
        this.spawnService = spawnService;
    }

    /**
     * Tells the sweeper which creatures are fighting and must not be removed.
     */
    public void setEngagedCheck(Predicate<String> engaged) {
        this.engaged = engaged;
    }

    public ScheduledTask initialize(EventScheduler scheduler, long sweepMillis) {
        logger.info("[ExpirySweeper] Sweeping every {}ms", sweepMillis);
        return scheduler.scheduleRecurring("expiry-sweep", this::sweepAll, sweepMillis, sweepMillis);
    }

    /**
     * Sweep one room.
     * @return number of instances removed
     */
    public int sweepRoom(String roomId) {
        return locks.withRoom(roomId, () -> {
            long now = clock.nowMillis();
            int removed = 0;
            for (EntityInstance inst : registry.instancesInRoom(roomId)) {
                if (!inst.isExpired(now)) continue;
                if (inst instanceof ItemInstance item) {
                    registry.remove(item.getRef());
                    spawnService.releaseLootSlot(item);
                    SpawnEventLogger.info("[EXPIRE] item={} room={}", item.getRef(), roomId);
                    removed++;
                } else if (inst instanceof CombatantInstance ci && ci.getEncounterId() != null
                        && !engaged.test(ci.getRef())) {
                    registry.remove(ci.getRef());
                    SpawnEventLogger.info("[EXPIRE] creature={} encounter={} room={}",
                            ci.getRef(), ci.getEncounterId(), roomId);
                    removed++;
                }
            }
            RoomState state = rooms.get(roomId);
            if (state != null && !state.getActiveEncounters().isEmpty()) {
                Set<String> live = liveEncounterIds();
                for (String encounterId : state.getActiveEncounters()) {
                    if (!live.contains(encounterId)) state.removeEncounter(encounterId);
                }
            }
            rooms.removeIfIdle(roomId);
            return removed;
        });
    }

    /**
     * Sweep every room that holds entities or a room state.
     * @return number of instances removed
     */
    public int sweepAll() {
        Set<String> roomIds = new TreeSet<>(registry.occupiedRooms());
        for (RoomState state : rooms.all()) {
            roomIds.add(state.getRoomId());
        }
        int removed = 0;
        for (String roomId : roomIds) {
            removed += sweepRoom(roomId);
        }
        if (removed > 0) {
            logger.debug("[ExpirySweeper] Removed {} expired instances", removed);
        }
        return removed;
    }

    private Set<String> liveEncounterIds() {
        Set<String> ids = new HashSet<>();
        for (EntityInstance inst : registry.allInstances()) {
            if (inst.getEncounterId() != null) ids.add(inst.getEncounterId());
        }
        return ids;
    }
}
