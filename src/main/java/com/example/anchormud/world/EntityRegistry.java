package com.example.anchormud.world;

import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.EntityInstance;
import com.example.anchormud.model.EntityPosition;
import com.example.anchormud.model.ItemInstance;
import com.example.anchormud.model.NpcInstance;
import com.example.anchormud.model.PlayerCharacter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every live entity instance, every connected player character and the
 * single position record binding each of them to a room.
 *
 * Reads are safe from any thread. Mutations for a room must be made while
 * holding that room's lock (see {@link RoomLockManager}); a move holds both
 * rooms' locks. Positions change only through {@link #setPosition} and
 * {@link #move}; instances are never relocated by editing other records.
 */
public class EntityRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EntityRegistry.class);

    /** Players first, then instances by ascending id. */
    static final Comparator<String> REF_ORDER = (a, b) -> {
        boolean pa = PlayerCharacter.isPlayerRef(a);
        boolean pb = PlayerCharacter.isPlayerRef(b);
        if (pa != pb) return pa ? -1 : 1;
        if (pa) return a.compareTo(b);
        return Long.compare(EntityInstance.idFromRef(a), EntityInstance.idFromRef(b));
    };

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, EntityInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, PlayerCharacter> players = new ConcurrentHashMap<>();
    private final Map<String, EntityPosition> positions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> roomIndex = new ConcurrentHashMap<>();

    public long nextInstanceId() {
        return nextId.getAndIncrement();
    }

    // ========== Registration ==========

    /**
     * Add an instance and its position in one step.
     */
    public void place(EntityInstance instance, String roomId) {
        if (instances.putIfAbsent(instance.getInstanceId(), instance) != null) {
            throw new IllegalStateException("Instance already registered: " + instance);
        }
        setPosition(EntityPosition.at(instance.getRef(), roomId));
    }

    public void placePlayer(PlayerCharacter pc, String roomId) {
        players.put(pc.getRef(), pc);
        setPosition(EntityPosition.at(pc.getRef(), roomId));
    }

    /**
     * Remove an instance together with its position.
     * @return the removed instance, or null if it was not registered
     */
    public EntityInstance remove(String ref) {
        long id = EntityInstance.idFromRef(ref);
        EntityInstance removed = id < 0 ? null : instances.remove(id);
        dropPosition(ref);
        return removed;
    }

    public PlayerCharacter removePlayer(String ref) {
        PlayerCharacter pc = players.remove(ref);
        dropPosition(ref);
        return pc;
    }

    private void dropPosition(String ref) {
        EntityPosition old = positions.remove(ref);
        if (old != null) {
            Set<String> set = roomIndex.get(old.roomId());
            if (set != null) set.remove(ref);
        }
    }

    // ========== Lookup ==========

    public EntityInstance getInstance(String ref) {
        long id = EntityInstance.idFromRef(ref);
        return id < 0 ? null : instances.get(id);
    }

    public EntityInstance getInstance(long id) {
        return instances.get(id);
    }

    public CombatantInstance getCombatantInstance(String ref) {
        return getInstance(ref) instanceof CombatantInstance ci ? ci : null;
    }

    public PlayerCharacter getPlayer(String ref) {
        return ref == null ? null : players.get(ref);
    }

    public PlayerCharacter getPlayerByName(String name) {
        return name == null ? null : players.get(PlayerCharacter.refFor(name));
    }

    /**
     * Whether the ref names a registered instance or player.
     */
    public boolean isLive(String ref) {
        if (ref == null) return false;
        if (PlayerCharacter.isPlayerRef(ref)) return players.containsKey(ref);
        return getInstance(ref) != null;
    }

    /**
     * Position of a live entity. A position whose entity is gone is stale:
     * it is purged and null is returned.
     */
    public EntityPosition positionOf(String ref) {
        if (ref == null) return null;
        EntityPosition pos = positions.get(ref);
        if (pos != null && !isLive(ref)) {
            logger.warn("[EntityRegistry] Purging stale position for {} in {}", ref, pos.roomId());
            dropPosition(ref);
            return null;
        }
        return pos;
    }

    public String roomOf(String ref) {
        EntityPosition pos = positionOf(ref);
        return pos == null ? null : pos.roomId();
    }

    // ========== Position updates ==========

    /**
     * Replace an entity's position, updating the room index when the room changes.
     */
    public void setPosition(EntityPosition pos) {
        if (!isLive(pos.ref())) {
            throw new IllegalStateException("Cannot position unregistered entity " + pos.ref());
        }
        EntityPosition old = positions.put(pos.ref(), pos);
        if (old != null && !old.roomId().equals(pos.roomId())) {
            Set<String> set = roomIndex.get(old.roomId());
            if (set != null) set.remove(pos.ref());
        }
        roomIndex.computeIfAbsent(pos.roomId(), k -> new ConcurrentSkipListSet<>(REF_ORDER)).add(pos.ref());
    }

    /**
     * Move an entity to another room. Combat band and target are cleared.
     */
    public EntityPosition move(String ref, String toRoomId) {
        EntityPosition current = positionOf(ref);
        if (current == null) {
            throw new IllegalStateException("Cannot move " + ref + ": no position");
        }
        EntityPosition next = current.withRoom(toRoomId);
        setPosition(next);
        return next;
    }

    // ========== Room queries ==========

    /**
     * Refs in a room, players first, then instances by age. Stale refs are purged.
     */
    public List<String> refsInRoom(String roomId) {
        Set<String> set = roomIndex.get(roomId);
        if (set == null || set.isEmpty()) return Collections.emptyList();
        List<String> out = new ArrayList<>(set.size());
        for (String ref : set) {
            if (positionOf(ref) != null) out.add(ref);
        }
        return out;
    }

    public List<PlayerCharacter> playersInRoom(String roomId) {
        List<PlayerCharacter> out = new ArrayList<>();
        for (String ref : refsInRoom(roomId)) {
            PlayerCharacter pc = players.get(ref);
            if (pc != null) out.add(pc);
        }
        return out;
    }

    public List<EntityInstance> instancesInRoom(String roomId) {
        List<EntityInstance> out = new ArrayList<>();
        for (String ref : refsInRoom(roomId)) {
            EntityInstance inst = getInstance(ref);
            if (inst != null) out.add(inst);
        }
        return out;
    }

    public List<CombatantInstance> combatantsInRoom(String roomId) {
        List<CombatantInstance> out = new ArrayList<>();
        for (EntityInstance inst : instancesInRoom(roomId)) {
            if (inst instanceof CombatantInstance ci) out.add(ci);
        }
        return out;
    }

    public List<ItemInstance> itemsInRoom(String roomId) {
        List<ItemInstance> out = new ArrayList<>();
        for (EntityInstance inst : instancesInRoom(roomId)) {
            if (inst instanceof ItemInstance item) out.add(item);
        }
        return out;
    }

    public NpcInstance findNpc(String templateId) {
        for (EntityInstance inst : instances.values()) {
            if (inst instanceof NpcInstance npc && npc.getTemplateId().equals(templateId)) return npc;
        }
        return null;
    }

    public boolean hasPlayers(String roomId) {
        for (String ref : refsInRoom(roomId)) {
            if (PlayerCharacter.isPlayerRef(ref)) return true;
        }
        return false;
    }

    public Collection<EntityInstance> allInstances() {
        return Collections.unmodifiableCollection(instances.values());
    }

    public Collection<PlayerCharacter> allPlayers() {
        return Collections.unmodifiableCollection(players.values());
    }

    /**
     * Rooms currently holding at least one entity.
     */
    public Set<String> occupiedRooms() {
        Set<String> out = new TreeSet<>();
        for (Map.Entry<String, Set<String>> e : roomIndex.entrySet()) {
            if (!e.getValue().isEmpty()) out.add(e.getKey());
        }
        return out;
    }

    public int instanceCount() {
        return instances.size();
    }
}
