package com.example.anchormud.util;

import com.example.anchormud.model.NpcTemplate;
import com.example.anchormud.model.ScheduleBlock;
import com.example.anchormud.persistence.WorldContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves where schedule-bound NPCs should be at the current world time.
 *
 * Blocks are non-overlapping per NPC, so at most one matches a given minute.
 * When none matches the NPC is absent. An NPC that is busy (in combat,
 * mid-transaction, mid-dialogue) keeps its current room; the move is deferred
 * and applied at the first resolution after it is free again.
 */
public class NpcScheduleService {
    private static final Logger logger = LoggerFactory.getLogger(NpcScheduleService.class);

    private final GameClock clock;
    private final Map<String, NpcTemplate> npcs = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> roomIndex = new ConcurrentHashMap<>();
    private final Map<String, String> deferred = new ConcurrentHashMap<>();   // npc id -> reason

    public NpcScheduleService(GameClock clock) {
        this.clock = clock;
    }

    /**
     * Register an NPC's schedule.
     * @throws com.example.anchormud.persistence.ContentException if blocks overlap
     */
    public void register(NpcTemplate npc) {
        WorldContent.validateSchedule(npc.getId(), npc.getSchedule());
        npcs.put(npc.getId(), npc);
        for (ScheduleBlock block : npc.getSchedule()) {
            roomIndex.computeIfAbsent(block.roomId(), k -> ConcurrentHashMap.newKeySet()).add(npc.getId());
        }
        if (npc.getSchedule().isEmpty() && npc.getHomeRoomId() != null) {
            roomIndex.computeIfAbsent(npc.getHomeRoomId(), k -> ConcurrentHashMap.newKeySet()).add(npc.getId());
        }
        logger.debug("[NpcScheduleService] Registered {} with {} blocks", npc.getId(), npc.getSchedule().size());
    }

    public NpcTemplate getNpc(String npcId) {
        return npcs.get(npcId);
    }

    /**
     * NPCs that could ever appear in the room.
     */
    public Set<String> candidatesFor(String roomId) {
        Set<String> set = roomIndex.get(roomId);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    public Set<String> getNpcIds() {
        return Collections.unmodifiableSet(npcs.keySet());
    }

    /**
     * Room the schedule puts the NPC in at the given minute of day, or null if absent.
     * NPCs without a schedule are always at home.
     */
    public String scheduledRoom(String npcId, int minuteOfDay) {
        NpcTemplate npc = npcs.get(npcId);
        if (npc == null) return null;
        List<ScheduleBlock> schedule = npc.getSchedule();
        if (schedule.isEmpty()) return npc.getHomeRoomId();
        for (ScheduleBlock block : schedule) {
            if (block.contains(minuteOfDay)) return block.roomId();
        }
        return null;
    }

    /**
     * Where the NPC should be now, honouring deferral.
     *
     * @param currentRoomId room the NPC occupies, null if absent
     * @param busyReason    non-null when the NPC cannot move right now
     * @return the room to place the NPC in, or null when it should be absent
     */
    public String resolve(String npcId, String currentRoomId, String busyReason) {
        String target = scheduledRoom(npcId, clock.minuteOfDay());
        if (currentRoomId != null && !currentRoomId.equals(target) && busyReason != null) {
            if (deferred.put(npcId, busyReason) == null) {
                logger.debug("[NpcScheduleService] Deferring {} move ({}), staying in {}", npcId, busyReason, currentRoomId);
            }
            return currentRoomId;
        }
        if (deferred.remove(npcId) != null) {
            logger.debug("[NpcScheduleService] Applying deferred move for {} -> {}", npcId, target);
        }
        return target;
    }

    public boolean isDeferred(String npcId) {
        return deferred.containsKey(npcId);
    }
}
