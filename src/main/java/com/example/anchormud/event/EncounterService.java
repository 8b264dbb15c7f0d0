package com.example.anchormud.event;

import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.EncounterTable;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.RoomFlag;
import com.example.anchormud.model.RoomState;
import com.example.anchormud.persistence.WorldContent;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.OpposedCheck;
import com.example.anchormud.util.SpawnEventLogger;
import com.example.anchormud.world.RoomLockManager;
import com.example.anchormud.world.RoomStateManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolls wandering encounters when players enter rooms of a zone that has an
 * encounter table. Encounter creatures share an encounter id and expire if
 * nobody engages them.
 */
public class EncounterService {

    private final GameClock clock;
    private final RoomStateManager rooms;
    private final RoomLockManager locks;
    private final WorldContent content;
    private final SpawnService spawnService;
    private final Random rng;
    private final double rollChance;
    private final long cooldownMillis;
    private final long lifetimeMillis;
    private final AtomicLong nextEncounter = new AtomicLong(1);

    public EncounterService(GameClock clock, RoomStateManager rooms, RoomLockManager locks, WorldContent content,
                            SpawnService spawnService, Random rng,
                            double rollChance, long cooldownMillis, long lifetimeMillis) {
        this.clock = clock;
        this.rooms = rooms;
        this.locks = locks;
        this.content = content;
        this.spawnService = spawnService;
        this.rng = rng;
        this.rollChance = rollChance;
        this.cooldownMillis = cooldownMillis;
        this.lifetimeMillis = lifetimeMillis;
    }

    /**
     * Roll for an encounter in the room if its zone has a table and the room's
     * encounter cooldown has passed.
     * @return the creatures that appeared, usually none
     */
    public List<CombatantInstance> maybeRollEncounter(String roomId) {
        Room room = content.getRoom(roomId);
        if (room == null || room.hasFlag(RoomFlag.NO_SPAWN) || room.hasFlag(RoomFlag.SAFE)) {
            return Collections.emptyList();
        }
        EncounterTable table = content.getEncounterTable(room.getZoneId());
        if (table == null) {
            return Collections.emptyList();
        }
        return locks.withRoom(roomId, () -> {
            RoomState state = rooms.getOrCreate(roomId);
            long now = clock.nowMillis();
            if (!state.tryClaimEncounterRoll(now, cooldownMillis)) {
                return Collections.<CombatantInstance>emptyList();
            }
            if (rng.nextDouble() >= rollChance) {
                return Collections.<CombatantInstance>emptyList();
            }
            int roll = OpposedCheck.d100(rng);
            EncounterTable.Row row = table.select(roll);
            if (row == null) {
                return Collections.<CombatantInstance>emptyList();
            }
            String encounterId = "enc-" + nextEncounter.getAndIncrement();
            List<CombatantInstance> spawned = new ArrayList<>();
            for (EncounterTable.Member member : row.members()) {
                int count = member.minCount() + rng.nextInt(member.maxCount() - member.minCount() + 1);
                for (int i = 0; i < count; i++) {
                    spawned.add(spawnService.createCombatant(member.templateId(), roomId, null,
                            encounterId, now + lifetimeMillis));
                }
            }
            if (!spawned.isEmpty()) {
                state.addEncounter(encounterId);
            }
            SpawnEventLogger.info("[ENCOUNTER] id={} zone={} room={} roll={} creatures={}",
                    encounterId, table.getZoneId(), roomId, roll, spawned.size());
            return spawned;
        });
    }
}
