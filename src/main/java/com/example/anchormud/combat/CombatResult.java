package com.example.anchormud.combat;

/**
 * Result of one attack resolution.
 * Contains all information needed to display the attack and to apply it later
 * in the resolution phase.
 */
public class CombatResult {

    public enum ResultType {
        HIT,            // Normal hit with damage
        MISS,           // Attack missed
        CRITICAL_HIT,   // Critical hit (extra damage)
        GLANCING_BLOW   // Defender nearly avoided it (reduced damage)
    }

    private final ResultType type;
    private final String attackerRef;
    private final String targetRef;
    private final String attackerName;
    private final String targetName;

    /** Damage rolled before armor (after critical / glancing adjustment) */
    private final int rawDamage;

    /** Damage left after armor; never negative, never above rawDamage */
    private final int damage;

    /** Damage soaked by armor */
    private final int absorbed;

    /** Roll values for display */
    private int attackRoll;
    private int defenseRoll;

    /** Maneuver name, null for a basic attack */
    private String maneuverName;

    private CombatResult(ResultType type, Combatant attacker, Combatant target,
                         int rawDamage, int damage, int absorbed) {
        this.type = type;
        this.attackerRef = attacker.getRef();
        this.targetRef = target.getRef();
        this.attackerName = attacker.getName();
        this.targetName = target.getName();
        this.rawDamage = rawDamage;
        this.damage = damage;
        this.absorbed = absorbed;
    }

    // Static factory methods

    public static CombatResult hit(Combatant attacker, Combatant target, int rawDamage, int damage, int absorbed) {
        return new CombatResult(ResultType.HIT, attacker, target, rawDamage, damage, absorbed);
    }

    public static CombatResult criticalHit(Combatant attacker, Combatant target, int rawDamage, int damage, int absorbed) {
        return new CombatResult(ResultType.CRITICAL_HIT, attacker, target, rawDamage, damage, absorbed);
    }

    public static CombatResult glancingBlow(Combatant attacker, Combatant target, int rawDamage, int damage, int absorbed) {
        return new CombatResult(ResultType.GLANCING_BLOW, attacker, target, rawDamage, damage, absorbed);
    }

    public static CombatResult miss(Combatant attacker, Combatant target) {
        return new CombatResult(ResultType.MISS, attacker, target, 0, 0, 0);
    }

    public CombatResult withRolls(int attackRoll, int defenseRoll) {
        this.attackRoll = attackRoll;
        this.defenseRoll = defenseRoll;
        return this;
    }

    public CombatResult withManeuver(String maneuverName) {
        this.maneuverName = maneuverName;
        return this;
    }

    // Getters

    public ResultType getType() { return type; }
    public String getAttackerRef() { return attackerRef; }
    public String getTargetRef() { return targetRef; }
    public String getAttackerName() { return attackerName; }
    public String getTargetName() { return targetName; }
    public int getRawDamage() { return rawDamage; }
    public int getDamage() { return damage; }
    public int getAbsorbed() { return absorbed; }
    public int getAttackRoll() { return attackRoll; }
    public int getDefenseRoll() { return defenseRoll; }
    public String getManeuverName() { return maneuverName; }

    public boolean isHit() {
        return type != ResultType.MISS;
    }

    public boolean isCritical() {
        return type == ResultType.CRITICAL_HIT;
    }

    /**
     * Line shown to everyone in the room.
     */
    public String describe() {
        String how = maneuverName == null ? "" : " with " + maneuverName;
        return switch (type) {
            case MISS -> attackerName + " misses " + targetName + how + ".";
            case GLANCING_BLOW -> attackerName + " grazes " + targetName + how + " for " + damage + describeArmor();
            case CRITICAL_HIT -> attackerName + " CRITICALLY hits " + targetName + how + " for " + damage + describeArmor();
            case HIT -> attackerName + " hits " + targetName + how + " for " + damage + describeArmor();
        };
    }

    private String describeArmor() {
        return absorbed > 0 ? " (" + absorbed + " absorbed)." : ".";
    }

    @Override
    public String toString() {
        return "CombatResult[" + type + " " + attackerRef + "->" + targetRef
                + " raw=" + rawDamage + " dmg=" + damage + " absorbed=" + absorbed + "]";
    }
}
