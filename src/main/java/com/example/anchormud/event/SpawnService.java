package com.example.anchormud.event;

import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.CombatantTemplate;
import com.example.anchormud.model.CreatureInstance;
import com.example.anchormud.model.CreatureTemplate;
import com.example.anchormud.model.EntityInstance;
import com.example.anchormud.model.ItemInstance;
import com.example.anchormud.model.ItemTemplate;
import com.example.anchormud.model.LootRule;
import com.example.anchormud.model.LootTable;
import com.example.anchormud.model.NpcInstance;
import com.example.anchormud.model.NpcTemplate;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.RoomFlag;
import com.example.anchormud.model.RoomState;
import com.example.anchormud.model.SpawnRule;
import com.example.anchormud.persistence.ContentException;
import com.example.anchormud.persistence.WorldContent;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.SpawnEventLogger;
import com.example.anchormud.world.EntityRegistry;
import com.example.anchormud.world.RoomLockManager;
import com.example.anchormud.world.RoomStateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates creatures and items from room spawn / loot rules and from loot
 * tables on death.
 *
 * Every firing is gated by the room state's compare-and-set on the rule timer,
 * so racing room entries can fire a rule at most once per cooldown window.
 * A caller that loses the race gets an empty result, not an error.
 */
public class SpawnService {
    private static final Logger logger = LoggerFactory.getLogger(SpawnService.class);

    private final GameClock clock;
    private final EntityRegistry registry;
    private final RoomStateManager rooms;
    private final RoomLockManager locks;
    private final WorldContent content;
    private final long itemExpiryMillis;
    private final long lootReservationMillis;
    private final AtomicLong lootRolls = new AtomicLong();

    public SpawnService(GameClock clock, EntityRegistry registry, RoomStateManager rooms, RoomLockManager locks,
                        WorldContent content, long itemExpiryMillis, long lootReservationMillis) {
        this.clock = clock;
        this.registry = registry;
        this.rooms = rooms;
        this.locks = locks;
        this.content = content;
        this.itemExpiryMillis = itemExpiryMillis;
        this.lootReservationMillis = lootReservationMillis;
    }

    // ========== Room rules ==========

    /**
     * Fire every eligible spawn and loot rule of a room.
     * @return instances created by this call
     */
    public List<EntityInstance> evaluateRoom(String roomId) {
        Room room = content.getRoom(roomId);
        if (room == null || room.hasFlag(RoomFlag.NO_SPAWN)) {
            return Collections.emptyList();
        }
        if (room.getSpawnRules().isEmpty() && room.getLootRules().isEmpty()) {
            return Collections.emptyList();
        }
        return locks.withRoom(roomId, () -> {
            RoomState state = rooms.getOrCreate(roomId);
            long now = clock.nowMillis();
            List<EntityInstance> created = new ArrayList<>();
            for (SpawnRule rule : room.getSpawnRules()) {
                created.addAll(fireSpawnRule(room, state, rule, now));
            }
            for (LootRule rule : room.getLootRules()) {
                created.addAll(fireLootRule(room, state, rule, now));
            }
            return created;
        });
    }

    private List<EntityInstance> fireSpawnRule(Room room, RoomState state, SpawnRule rule, long now) {
        Random rng = ruleRandom(state, rule.id(), now);
        int wanted = rule.minCount() + rng.nextInt(rule.maxCount() - rule.minCount() + 1);
        int granted = state.tryConsumeSpawn(rule.id(), now, rule.cooldownMillis(), rule.maxAlive(), wanted);
        if (granted == 0) {
            return Collections.emptyList();
        }
        List<EntityInstance> out = new ArrayList<>(granted);
        for (int i = 0; i < granted; i++) {
            out.add(createCombatant(rule.templateId(), room.getId(), rule.id(), null, 0));
        }
        SpawnEventLogger.info("[SPAWN] rule={} room={} template={} count={} alive={}",
                rule.id(), room.getId(), rule.templateId(), granted, state.spawnTimer(rule.id()).alive());
        return out;
    }

    private List<EntityInstance> fireLootRule(Room room, RoomState state, LootRule rule, long now) {
        ItemTemplate template = content.getItemTemplate(rule.itemTemplateId());
        if (template == null) {
            SpawnEventLogger.error("[LOOT] rule={} room={} unknown item template {}",
                    rule.id(), room.getId(), rule.itemTemplateId());
            return Collections.emptyList();
        }
        Random rng = ruleRandom(state, rule.id(), now);
        int quantity = rule.minQuantity() + rng.nextInt(rule.maxQuantity() - rule.minQuantity() + 1);
        int granted = state.tryConsumeLoot(rule.id(), now, rule.cooldownMillis(), rule.maxAlive(), 1);
        if (granted == 0) {
            return Collections.emptyList();
        }
        long expiry = rule.expirySeconds() > 0 ? now + rule.expirySeconds() * 1000L : now + itemExpiryMillis;
        ItemInstance item = new ItemInstance(registry.nextInstanceId(), template, now, expiry,
                room.getId(), rule.id(), quantity);
        registry.place(item, room.getId());
        SpawnEventLogger.info("[LOOT] rule={} room={} item={} qty={} expires={}",
                rule.id(), room.getId(), template.getId(), quantity, expiry);
        return List.of(item);
    }

    private static Random ruleRandom(RoomState state, String ruleId, long now) {
        return new Random(state.getSeed() ^ ((long) ruleId.hashCode() << 16) ^ now);
    }

    // ========== Instance creation ==========

    /**
     * Create a creature or NPC instance and position it in a room.
     * Caller holds the room lock.
     */
    public CombatantInstance createCombatant(String templateId, String roomId, String spawnRuleId,
                                             String encounterId, long expiresAt) {
        CombatantTemplate template = content.getCombatTemplate(templateId);
        long now = clock.nowMillis();
        CombatantInstance inst;
        if (template instanceof NpcTemplate npc) {
            inst = new NpcInstance(registry.nextInstanceId(), npc, now, roomId);
        } else if (template instanceof CreatureTemplate creature) {
            inst = new CreatureInstance(registry.nextInstanceId(), creature, now, expiresAt,
                    roomId, spawnRuleId, encounterId);
        } else {
            throw new ContentException("Not a combatant template: " + templateId);
        }
        registry.place(inst, roomId);
        logger.debug("[SpawnService] Created {} in {}", inst, roomId);
        return inst;
    }

    // ========== Death and removal ==========

    /**
     * Give back the spawn-rule slot a removed combatant occupied.
     */
    public void releaseSpawnSlot(EntityInstance inst) {
        if (inst.getSpawnRuleId() == null) return;
        RoomState state = rooms.get(inst.getOriginRoomId());
        if (state != null) {
            state.releaseSpawn(inst.getSpawnRuleId(), 1);
        }
    }

    /**
     * Give back the loot-rule slot of an item that was picked up or expired.
     */
    public void releaseLootSlot(ItemInstance item) {
        if (item.getLootRuleId() == null) return;
        RoomState state = rooms.get(item.getOriginRoomId());
        if (state != null) {
            state.releaseLoot(item.getLootRuleId(), 1);
        }
    }

    /**
     * Roll a dead combatant's loot table once and drop the results in the room.
     * Caller holds the room lock.
     *
     * @param killerSessionId session the drops are reserved for, or null
     */
    public List<ItemInstance> rollDeathLoot(CombatantInstance dead, String roomId, String killerSessionId) {
        LootTable table = content.getLootTable(dead.getCombatTemplate().getLootTableId());
        if (table == null) {
            return Collections.emptyList();
        }
        long now = clock.nowMillis();
        RoomState state = rooms.getOrCreate(roomId);
        lootRolls.incrementAndGet();
        Random rng = new Random(state.getSeed() ^ (dead.getInstanceId() * 31L) ^ now);
        List<ItemInstance> drops = new ArrayList<>();
        for (LootTable.Drop drop : table.roll(rng)) {
            ItemTemplate template = content.getItemTemplate(drop.itemTemplateId());
            if (template == null) {
                SpawnEventLogger.error("[DROP] table={} unknown item template {}", table.getId(), drop.itemTemplateId());
                continue;
            }
            ItemInstance item = new ItemInstance(registry.nextInstanceId(), template, now,
                    now + itemExpiryMillis, roomId, null, drop.quantity());
            if (killerSessionId != null) {
                item.reserve(killerSessionId, now + lootReservationMillis);
            }
            registry.place(item, roomId);
            drops.add(item);
        }
        SpawnEventLogger.info("[DROP] table={} victim={} room={} items={}",
                table.getId(), dead.getRef(), roomId, drops.size());
        return drops;
    }

    /** Number of death loot rolls made since startup. */
    public long getLootRollCount() {
        return lootRolls.get();
    }
}
