package com.example.anchormud.model;

import java.util.List;
import java.util.Map;

/**
 * Blueprint for a spawned creature.
 */
public class CreatureTemplate extends CombatantTemplate {

    public CreatureTemplate(String id, String name, List<String> keywords, Map<String, Object> extensions,
                            int maxHp, int accuracy, int avoidance, int initiativeBonus,
                            AttackProfile attack, BehaviorProfile behavior, List<ArmorPiece> armor,
                            String lootTableId) {
        super(id, name, keywords, extensions, maxHp, accuracy, avoidance, initiativeBonus,
                attack, behavior, armor, lootTableId, true);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.CREATURE;
    }
}
