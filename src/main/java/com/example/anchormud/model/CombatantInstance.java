package com.example.anchormud.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Live creature or NPC with hit points, attack profile and armor.
 * Hit points are clamped to [0, max]; the registry removes an instance in the
 * same step that brings it to zero.
 */
public abstract class CombatantInstance extends EntityInstance {

    private int hp;
    private final List<ArmorPiece> armor;

    // pursuit bookkeeping; -1 when not pursuing
    private long pursuitStartedAt = -1;
    private int pursuitRooms;

    protected CombatantInstance(long instanceId, CombatantTemplate template, long createdAt, long expiresAt,
                                String originRoomId, String spawnRuleId, String encounterId) {
        super(instanceId, template, createdAt, expiresAt, originRoomId, spawnRuleId, null, encounterId);
        this.hp = template.getMaxHp();
        List<ArmorPiece> copies = new ArrayList<>();
        for (ArmorPiece p : template.getArmor()) {
            copies.add(p.copy());
        }
        this.armor = Collections.unmodifiableList(copies);
    }

    public CombatantTemplate getCombatTemplate() {
        return (CombatantTemplate) getTemplate();
    }

    public int getHp() { return hp; }
    public int getMaxHp() { return getCombatTemplate().getMaxHp(); }

    public void setHp(int hp) {
        this.hp = Math.max(0, Math.min(getMaxHp(), hp));
    }

    /**
     * Subtract damage, clamped at zero.
     * @return hit points actually lost
     */
    public int applyDamage(int amount) {
        if (amount < 0) throw new IllegalArgumentException("negative damage: " + amount);
        int before = hp;
        setHp(hp - amount);
        return before - hp;
    }

    public boolean isDead() {
        return hp <= 0;
    }

    public List<ArmorPiece> getArmor() { return armor; }
    public AttackProfile getAttack() { return getCombatTemplate().getAttack(); }
    public BehaviorProfile getBehavior() { return getCombatTemplate().getBehavior(); }
    public int getAccuracy() { return getCombatTemplate().getAccuracy(); }
    public int getAvoidance() { return getCombatTemplate().getAvoidance(); }

    public boolean isPursuing() { return pursuitStartedAt >= 0; }
    public long getPursuitStartedAt() { return pursuitStartedAt; }
    public int getPursuitRooms() { return pursuitRooms; }

    /**
     * Record one more room of pursuit, starting the leash clock on the first step.
     */
    public void notePursuitStep(long nowMillis) {
        if (pursuitStartedAt < 0) pursuitStartedAt = nowMillis;
        pursuitRooms++;
    }

    public void clearPursuit() {
        pursuitStartedAt = -1;
        pursuitRooms = 0;
    }
}
