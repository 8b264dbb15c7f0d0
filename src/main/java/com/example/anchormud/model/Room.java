package com.example.anchormud.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable room definition.
 */
public class Room {

    private final String id;
    private final String name;
    private final String description;
    private final String regionId;           // weather region
    private final String zoneId;             // encounter zone, may be null
    private final WeatherExposure exposure;
    private final Set<RoomFlag> flags;
    private final Map<Direction, String> exits;
    private final List<SpawnRule> spawnRules;
    private final List<LootRule> lootRules;

    public Room(String id, String name, String description, String regionId, String zoneId,
                WeatherExposure exposure, Set<RoomFlag> flags, Map<Direction, String> exits,
                List<SpawnRule> spawnRules, List<LootRule> lootRules) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("room id is required");
        this.id = id;
        this.name = name == null ? id : name;
        this.description = description == null ? "" : description;
        this.regionId = regionId;
        this.zoneId = zoneId;
        this.exposure = exposure == null ? WeatherExposure.OUTDOOR : exposure;
        this.flags = flags == null || flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        Map<Direction, String> ex = new EnumMap<>(Direction.class);
        if (exits != null) ex.putAll(exits);
        this.exits = Collections.unmodifiableMap(ex);
        this.spawnRules = spawnRules == null ? Collections.emptyList() : List.copyOf(spawnRules);
        this.lootRules = lootRules == null ? Collections.emptyList() : List.copyOf(lootRules);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getRegionId() { return regionId; }
    public String getZoneId() { return zoneId; }
    public WeatherExposure getExposure() { return exposure; }
    public Set<RoomFlag> getFlags() { return flags; }
    public Map<Direction, String> getExits() { return exits; }
    public List<SpawnRule> getSpawnRules() { return spawnRules; }
    public List<LootRule> getLootRules() { return lootRules; }

    public boolean hasFlag(RoomFlag flag) {
        return flags.contains(flag);
    }

    public String getExit(Direction dir) {
        return dir == null ? null : exits.get(dir);
    }
}
