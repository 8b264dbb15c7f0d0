package com.example.anchormud.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Blueprint fields common to creatures and NPCs.
 */
public abstract class CombatantTemplate extends EntityTemplate {

    private final int maxHp;
    private final int accuracy;          // 0-100 attack skill
    private final int avoidance;         // 0-100 defense skill
    private final int initiativeBonus;
    private final AttackProfile attack;
    private final BehaviorProfile behavior;
    private final List<ArmorPiece> armor; // copied per instance
    private final String lootTableId;     // may be null
    private final boolean hostile;        // fights players when provoked or aggressive

    protected CombatantTemplate(String id, String name, List<String> keywords, Map<String, Object> extensions,
                                int maxHp, int accuracy, int avoidance, int initiativeBonus,
                                AttackProfile attack, BehaviorProfile behavior, List<ArmorPiece> armor,
                                String lootTableId, boolean hostile) {
        super(id, name, keywords, extensions);
        if (maxHp <= 0) throw new IllegalArgumentException("maxHp must be positive for " + id);
        this.maxHp = maxHp;
        this.accuracy = accuracy;
        this.avoidance = avoidance;
        this.initiativeBonus = initiativeBonus;
        this.attack = attack == null ? AttackProfile.UNARMED : attack;
        this.behavior = behavior == null ? BehaviorProfile.PASSIVE : behavior;
        this.armor = armor == null ? Collections.emptyList() : List.copyOf(armor);
        this.lootTableId = lootTableId;
        this.hostile = hostile;
    }

    public int getMaxHp() { return maxHp; }
    public int getAccuracy() { return accuracy; }
    public int getAvoidance() { return avoidance; }
    public int getInitiativeBonus() { return initiativeBonus; }
    public AttackProfile getAttack() { return attack; }
    public BehaviorProfile getBehavior() { return behavior; }
    public List<ArmorPiece> getArmor() { return armor; }
    public String getLootTableId() { return lootTableId; }
    public boolean isHostile() { return hostile; }
}
