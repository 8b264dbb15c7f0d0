package com.example.anchormud.persistence;

import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.BehaviorProfile;
import com.example.anchormud.model.CombatModifier;
import com.example.anchormud.model.CreatureTemplate;
import com.example.anchormud.model.DamageType;
import com.example.anchormud.model.Direction;
import com.example.anchormud.model.EncounterTable;
import com.example.anchormud.model.ItemTemplate;
import com.example.anchormud.model.LootRule;
import com.example.anchormud.model.LootTable;
import com.example.anchormud.model.ManeuverDefinition;
import com.example.anchormud.model.NpcTemplate;
import com.example.anchormud.model.PursuitMode;
import com.example.anchormud.model.ReactionTrigger;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.RoomFlag;
import com.example.anchormud.model.ScheduleBlock;
import com.example.anchormud.model.SpawnRule;
import com.example.anchormud.model.StoreHours;
import com.example.anchormud.model.ThreatProfile;
import com.example.anchormud.model.WeatherExposure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads world content from a YAML classpath resource (default {@code /data/world.yaml}).
 *
 * Keys a loader does not recognise for an entity kind are kept in the
 * template's extension map.
 */
public class YamlContentLoader {
    private static final Logger logger = LoggerFactory.getLogger(YamlContentLoader.class);

    public static final String DEFAULT_RESOURCE = "/data/world.yaml";

    private static final Set<String> CREATURE_KEYS = Set.of("id", "name", "keywords", "hp", "accuracy",
            "avoidance", "initiative", "attack", "behavior", "armor", "loot-table");
    private static final Set<String> NPC_KEYS = Set.of("id", "name", "keywords", "hp", "accuracy",
            "avoidance", "initiative", "attack", "behavior", "armor", "loot-table", "hostile", "home", "schedule");
    private static final Set<String> ITEM_KEYS = Set.of("id", "name", "keywords", "durability", "stackable");

    public WorldContent load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * @throws ContentException when the resource is missing or invalid
     */
    public WorldContent load(String resourcePath) {
        try (InputStream in = YamlContentLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new ContentException("Content resource not found: " + resourcePath);
            }
            Yaml yaml = new Yaml();
            Map<String, Object> root = yaml.load(in);
            if (root == null) {
                throw new ContentException("Content resource is empty: " + resourcePath);
            }
            WorldContent content = parse(root);
            logger.info("[YamlContentLoader] Loaded {} rooms, {} maneuvers from {}",
                    content.getRooms().size(), content.getManeuvers().size(), resourcePath);
            return content;
        } catch (ContentException e) {
            throw e;
        } catch (Exception e) {
            throw new ContentException("Failed to read " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    WorldContent parse(Map<String, Object> root) {
        WorldContent.Builder b = WorldContent.builder();
        for (Map<String, Object> m : list(root.get("maneuvers"))) {
            b.maneuver(parseManeuver(m));
        }
        for (Map<String, Object> m : list(root.get("items"))) {
            b.template(new ItemTemplate(str(m, "id", null), str(m, "name", null), strings(m.get("keywords")),
                    extensions(m, ITEM_KEYS), intVal(m, "durability", 0), bool(m, "stackable", false)));
        }
        for (Map<String, Object> m : list(root.get("loot-tables"))) {
            List<LootTable.Entry> entries = new ArrayList<>();
            for (Map<String, Object> e : list(m.get("entries"))) {
                entries.add(new LootTable.Entry(str(e, "item", null), dbl(e, "chance", 1.0),
                        intVal(e, "min", 1), intVal(e, "max", 1)));
            }
            b.lootTable(new LootTable(str(m, "id", null), entries));
        }
        for (Map<String, Object> m : list(root.get("creatures"))) {
            b.template(new CreatureTemplate(str(m, "id", null), str(m, "name", null), strings(m.get("keywords")),
                    extensions(m, CREATURE_KEYS), intVal(m, "hp", 1), intVal(m, "accuracy", 50),
                    intVal(m, "avoidance", 50), intVal(m, "initiative", 0), parseAttack(map(m.get("attack"))),
                    parseBehavior(map(m.get("behavior"))), parseArmor(m.get("armor")), str(m, "loot-table", null)));
        }
        for (Map<String, Object> m : list(root.get("npcs"))) {
            List<ScheduleBlock> schedule = new ArrayList<>();
            for (Map<String, Object> s : list(m.get("schedule"))) {
                try {
                    schedule.add(ScheduleBlock.parse(str(s, "start", null), str(s, "end", null), str(s, "room", null)));
                } catch (IllegalArgumentException e) {
                    throw new ContentException("NPC " + m.get("id") + ": " + e.getMessage(), e);
                }
            }
            b.template(new NpcTemplate(str(m, "id", null), str(m, "name", null), strings(m.get("keywords")),
                    extensions(m, NPC_KEYS), intVal(m, "hp", 10), intVal(m, "accuracy", 50),
                    intVal(m, "avoidance", 50), intVal(m, "initiative", 0), parseAttack(map(m.get("attack"))),
                    parseBehavior(map(m.get("behavior"))), parseArmor(m.get("armor")), str(m, "loot-table", null),
                    bool(m, "hostile", false), str(m, "home", null), schedule));
        }
        for (Map<String, Object> m : list(root.get("rooms"))) {
            b.room(parseRoom(m));
        }
        for (Map<String, Object> m : list(root.get("encounters"))) {
            List<EncounterTable.Row> rows = new ArrayList<>();
            for (Map<String, Object> r : list(m.get("rows"))) {
                List<Object> roll = new ArrayList<>();
                if (r.get("roll") instanceof List<?> l && !l.isEmpty()) {
                    roll.addAll(l);
                } else {
                    roll.add(1);
                    roll.add(100);
                }
                List<EncounterTable.Member> members = new ArrayList<>();
                for (Map<String, Object> mem : list(r.get("members"))) {
                    members.add(new EncounterTable.Member(str(mem, "template", null),
                            intVal(mem, "min", 1), intVal(mem, "max", 1)));
                }
                rows.add(new EncounterTable.Row(toInt(roll.get(0), 1), toInt(roll.get(roll.size() - 1), 100), members));
            }
            b.encounterTable(new EncounterTable(str(m, "zone", null), rows));
        }
        for (Map<String, Object> m : list(root.get("stores"))) {
            Set<Long> closedDays = new HashSet<>();
            for (String d : strings(m.get("closed-days"))) {
                closedDays.add((long) toInt(d, -1));
            }
            try {
                b.storeHours(StoreHours.parse(str(m, "id", null), str(m, "open", "08:00"), str(m, "close", "18:00"),
                        closedDays));
            } catch (IllegalArgumentException e) {
                throw new ContentException("Store " + m.get("id") + ": " + e.getMessage(), e);
            }
        }
        return b.build();
    }

    private ManeuverDefinition parseManeuver(Map<String, Object> m) {
        return new ManeuverDefinition(str(m, "id", null), str(m, "name", null), intVal(m, "stamina", 0),
                dbl(m, "delay", 0.0), intVal(m, "accuracy-bonus", 0), dbl(m, "damage-multiplier", 1.0),
                CombatModifier.fromString(str(m, "applies", null)), bool(m, "ranged", false),
                ReactionTrigger.fromString(str(m, "reaction", null)));
    }

    private AttackProfile parseAttack(Map<String, Object> m) {
        if (m.isEmpty()) return AttackProfile.UNARMED;
        return new AttackProfile(str(m, "name", "attack"), intVal(m, "min", 1), intVal(m, "max", 1),
                dbl(m, "speed", 1.0), DamageType.fromString(str(m, "type", null)), dbl(m, "crit", 0.01),
                bool(m, "ranged", false));
    }

    private BehaviorProfile parseBehavior(Map<String, Object> m) {
        if (m.isEmpty()) return BehaviorProfile.PASSIVE;
        return new BehaviorProfile(PursuitMode.fromString(str(m, "pursuit", null)), intVal(m, "leash-rooms", 0),
                intVal(m, "leash-seconds", 0), bool(m, "aggressive", false),
                ThreatProfile.fromString(str(m, "threat", null)));
    }

    private List<ArmorPiece> parseArmor(Object node) {
        List<ArmorPiece> pieces = new ArrayList<>();
        for (Map<String, Object> a : list(node)) {
            Set<DamageType> secondary = EnumSet.noneOf(DamageType.class);
            for (String s : strings(a.get("secondary"))) secondary.add(DamageType.fromString(s));
            pieces.add(new ArmorPiece(str(a, "name", "armor"), DamageType.fromString(str(a, "type", null)),
                    secondary, intVal(a, "reduction", 0), intVal(a, "durability", 0)));
        }
        return pieces;
    }

    private Room parseRoom(Map<String, Object> m) {
        String id = str(m, "id", null);
        Set<RoomFlag> flags = EnumSet.noneOf(RoomFlag.class);
        for (String f : strings(m.get("flags"))) {
            RoomFlag flag = RoomFlag.fromKey(f);
            if (flag == null) {
                logger.warn("[YamlContentLoader] Room {} has unknown flag '{}'", id, f);
            } else {
                flags.add(flag);
            }
        }
        Map<Direction, String> exits = new EnumMap<>(Direction.class);
        for (Map.Entry<String, Object> e : map(m.get("exits")).entrySet()) {
            Direction dir = Direction.fromString(e.getKey());
            if (dir == null) throw new ContentException("Room " + id + " has unknown exit direction " + e.getKey());
            exits.put(dir, String.valueOf(e.getValue()));
        }
        List<SpawnRule> spawns = new ArrayList<>();
        for (Map<String, Object> s : list(m.get("spawns"))) {
            spawns.add(new SpawnRule(str(s, "id", null), str(s, "template", null), intVal(s, "min", 1),
                    intVal(s, "max", 1), intVal(s, "max-alive", 1), intVal(s, "cooldown", 300)));
        }
        List<LootRule> loot = new ArrayList<>();
        for (Map<String, Object> l : list(m.get("loot"))) {
            loot.add(new LootRule(str(l, "id", null), str(l, "item", null), intVal(l, "min", 1),
                    intVal(l, "max", 1), intVal(l, "max-alive", 1), intVal(l, "cooldown", 600),
                    intVal(l, "expiry", 0)));
        }
        return new Room(id, str(m, "name", null), str(m, "description", null), str(m, "region", null),
                str(m, "zone", null), WeatherExposure.fromKey(str(m, "exposure", null)), flags, exits, spawns, loot);
    }

    // ========== YAML helpers ==========

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Object node) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (node instanceof List<?> l) {
            for (Object o : l) {
                if (o instanceof Map) out.add((Map<String, Object>) o);
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object node) {
        return node instanceof Map ? (Map<String, Object>) node : Map.of();
    }

    private static List<String> strings(Object node) {
        List<String> out = new ArrayList<>();
        if (node instanceof List<?> l) {
            for (Object o : l) if (o != null) out.add(o.toString());
        } else if (node != null) {
            out.add(node.toString());
        }
        return out;
    }

    private static Map<String, Object> extensions(Map<String, Object> m, Set<String> known) {
        Map<String, Object> ext = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : m.entrySet()) {
            if (!known.contains(e.getKey()) && e.getValue() != null) ext.put(e.getKey(), e.getValue());
        }
        return ext;
    }

    private static String str(Map<String, Object> m, String key, String def) {
        Object v = m.get(key);
        return v == null ? def : v.toString();
    }

    private static int intVal(Map<String, Object> m, String key, int def) {
        return toInt(m.get(key), def);
    }

    private static int toInt(Object v, int def) {
        if (v instanceof Number n) return n.intValue();
        if (v == null) return def;
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static double dbl(Map<String, Object> m, String key, double def) {
        Object v = m.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v == null) return def;
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static boolean bool(Map<String, Object> m, String key, boolean def) {
        Object v = m.get(key);
        if (v instanceof Boolean bv) return bv;
        if (v == null) return def;
        return Boolean.parseBoolean(v.toString().trim());
    }
}
