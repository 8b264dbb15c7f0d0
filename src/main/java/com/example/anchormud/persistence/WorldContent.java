package com.example.anchormud.persistence;

import com.example.anchormud.model.CombatantTemplate;
import com.example.anchormud.model.CreatureTemplate;
import com.example.anchormud.model.Direction;
import com.example.anchormud.model.EncounterTable;
import com.example.anchormud.model.EntityTemplate;
import com.example.anchormud.model.ItemTemplate;
import com.example.anchormud.model.LootRule;
import com.example.anchormud.model.LootTable;
import com.example.anchormud.model.ManeuverDefinition;
import com.example.anchormud.model.NpcTemplate;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.ScheduleBlock;
import com.example.anchormud.model.SpawnRule;
import com.example.anchormud.model.StoreHours;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable content supplied once at startup: rooms, templates, maneuvers,
 * loot and encounter tables. Cross references are checked when built.
 */
public final class WorldContent {

    private final Map<String, Room> rooms;
    private final Map<String, EntityTemplate> templates;
    private final Map<String, ManeuverDefinition> maneuvers;
    private final Map<String, LootTable> lootTables;
    private final Map<String, EncounterTable> encounterTables;
    private final Map<String, StoreHours> storeHours;

    private WorldContent(Builder b) {
        this.rooms = Collections.unmodifiableMap(new LinkedHashMap<>(b.rooms));
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(b.templates));
        this.maneuvers = Collections.unmodifiableMap(new LinkedHashMap<>(b.maneuvers));
        this.lootTables = Collections.unmodifiableMap(new LinkedHashMap<>(b.lootTables));
        this.encounterTables = Collections.unmodifiableMap(new LinkedHashMap<>(b.encounterTables));
        this.storeHours = Collections.unmodifiableMap(new LinkedHashMap<>(b.storeHours));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Room getRoom(String id) {
        return id == null ? null : rooms.get(id);
    }

    public Room requireRoom(String id) {
        Room r = getRoom(id);
        if (r == null) throw new ContentException("Unknown room: " + id);
        return r;
    }

    public Collection<Room> getRooms() {
        return rooms.values();
    }

    public EntityTemplate getTemplate(String id) {
        return id == null ? null : templates.get(id);
    }

    public CombatantTemplate getCombatTemplate(String id) {
        EntityTemplate t = getTemplate(id);
        return t instanceof CombatantTemplate ct ? ct : null;
    }

    public ItemTemplate getItemTemplate(String id) {
        EntityTemplate t = getTemplate(id);
        return t instanceof ItemTemplate it ? it : null;
    }

    public List<NpcTemplate> getNpcTemplates() {
        return templates.values().stream()
                .filter(t -> t instanceof NpcTemplate)
                .map(t -> (NpcTemplate) t)
                .toList();
    }

    public ManeuverDefinition getManeuver(String id) {
        return id == null ? null : maneuvers.get(id.toLowerCase(Locale.ROOT));
    }

    public Collection<ManeuverDefinition> getManeuvers() {
        return maneuvers.values();
    }

    public LootTable getLootTable(String id) {
        return id == null ? null : lootTables.get(id);
    }

    public EncounterTable getEncounterTable(String zoneId) {
        return zoneId == null ? null : encounterTables.get(zoneId);
    }

    public Collection<StoreHours> getStoreHours() {
        return storeHours.values();
    }

    public static final class Builder {
        private final Map<String, Room> rooms = new LinkedHashMap<>();
        private final Map<String, EntityTemplate> templates = new LinkedHashMap<>();
        private final Map<String, ManeuverDefinition> maneuvers = new LinkedHashMap<>();
        private final Map<String, LootTable> lootTables = new LinkedHashMap<>();
        private final Map<String, EncounterTable> encounterTables = new LinkedHashMap<>();
        private final Map<String, StoreHours> storeHours = new LinkedHashMap<>();

        public Builder room(Room room) {
            if (rooms.putIfAbsent(room.getId(), room) != null) {
                throw new ContentException("Duplicate room: " + room.getId());
            }
            return this;
        }

        public Builder template(EntityTemplate template) {
            if (templates.putIfAbsent(template.getId(), template) != null) {
                throw new ContentException("Duplicate template: " + template.getId());
            }
            return this;
        }

        public Builder maneuver(ManeuverDefinition m) {
            maneuvers.put(m.id().toLowerCase(Locale.ROOT), m);
            return this;
        }

        public Builder lootTable(LootTable table) {
            lootTables.put(table.getId(), table);
            return this;
        }

        public Builder storeHours(StoreHours hours) {
            storeHours.put(hours.storeId(), hours);
            return this;
        }

        public Builder encounterTable(EncounterTable table) {
            encounterTables.put(table.getZoneId(), table);
            return this;
        }

        /**
         * Validate references and freeze.
         * @throws ContentException on the first broken reference
         */
        public WorldContent build() {
            for (Room room : rooms.values()) {
                for (Map.Entry<Direction, String> exit : room.getExits().entrySet()) {
                    if (!rooms.containsKey(exit.getValue())) {
                        throw new ContentException("Room " + room.getId() + " exit " + exit.getKey().getName()
                                + " leads to unknown room " + exit.getValue());
                    }
                }
                for (SpawnRule rule : room.getSpawnRules()) {
                    if (!(templates.get(rule.templateId()) instanceof CombatantTemplate)) {
                        throw new ContentException("Spawn rule " + rule.id() + " in " + room.getId()
                                + " references unknown creature " + rule.templateId());
                    }
                }
                for (LootRule rule : room.getLootRules()) {
                    requireItem(rule.itemTemplateId(), "loot rule " + rule.id());
                }
            }
            for (EntityTemplate t : templates.values()) {
                if (t instanceof CombatantTemplate ct && ct.getLootTableId() != null
                        && !lootTables.containsKey(ct.getLootTableId())) {
                    throw new ContentException("Template " + t.getId() + " references unknown loot table "
                            + ct.getLootTableId());
                }
                if (t instanceof NpcTemplate npc) {
                    if (npc.getHomeRoomId() != null && !rooms.containsKey(npc.getHomeRoomId())) {
                        throw new ContentException("NPC " + npc.getId() + " has unknown home " + npc.getHomeRoomId());
                    }
                    validateSchedule(npc.getId(), npc.getSchedule());
                    for (ScheduleBlock block : npc.getSchedule()) {
                        if (!rooms.containsKey(block.roomId())) {
                            throw new ContentException("NPC " + npc.getId() + " is scheduled into unknown room "
                                    + block.roomId());
                        }
                    }
                }
            }
            for (LootTable table : lootTables.values()) {
                for (LootTable.Entry e : table.getEntries()) {
                    requireItem(e.itemTemplateId(), "loot table " + table.getId());
                }
            }
            for (EncounterTable table : encounterTables.values()) {
                for (EncounterTable.Row row : table.getRows()) {
                    for (EncounterTable.Member m : row.members()) {
                        if (!(templates.get(m.templateId()) instanceof CreatureTemplate)) {
                            throw new ContentException("Encounter table " + table.getZoneId()
                                    + " references unknown creature " + m.templateId());
                        }
                    }
                }
            }
            for (StoreHours hours : storeHours.values()) {
                if (!rooms.containsKey(hours.storeId()) && !(templates.get(hours.storeId()) instanceof NpcTemplate)) {
                    throw new ContentException("Store hours for unknown room or NPC " + hours.storeId());
                }
            }
            return new WorldContent(this);
        }

        private void requireItem(String id, String where) {
            if (!(templates.get(id) instanceof ItemTemplate)) {
                throw new ContentException(where + " references unknown item " + id);
            }
        }
    }

    /**
     * Reject schedules whose blocks share any minute.
     * @throws ContentException naming the first overlapping pair
     */
    public static void validateSchedule(String npcId, List<ScheduleBlock> blocks) {
        for (int i = 0; i < blocks.size(); i++) {
            for (int j = i + 1; j < blocks.size(); j++) {
                if (blocks.get(i).overlaps(blocks.get(j))) {
                    throw new ContentException("NPC " + npcId + " has overlapping schedule blocks: "
                            + blocks.get(i) + " and " + blocks.get(j));
                }
            }
        }
    }
}
