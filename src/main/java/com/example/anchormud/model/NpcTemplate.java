package com.example.anchormud.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Blueprint for a named, schedule-bound NPC. An NPC with an empty schedule
 * stays in its home room.
 */
public class NpcTemplate extends CombatantTemplate {

    private final String homeRoomId;
    private final List<ScheduleBlock> schedule;

    public NpcTemplate(String id, String name, List<String> keywords, Map<String, Object> extensions,
                       int maxHp, int accuracy, int avoidance, int initiativeBonus,
                       AttackProfile attack, BehaviorProfile behavior, List<ArmorPiece> armor,
                       String lootTableId, boolean hostile, String homeRoomId, List<ScheduleBlock> schedule) {
        super(id, name, keywords, extensions, maxHp, accuracy, avoidance, initiativeBonus,
                attack, behavior, armor, lootTableId, hostile);
        this.homeRoomId = homeRoomId;
        this.schedule = schedule == null ? Collections.emptyList() : List.copyOf(schedule);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.NPC;
    }

    public String getHomeRoomId() { return homeRoomId; }
    public List<ScheduleBlock> getSchedule() { return schedule; }
}
