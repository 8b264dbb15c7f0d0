package com.example.anchormud.model;

/**
 * Basic attack parameters for a weapon or natural attack.
 *
 * @param name        display name ("rusty cutlass", "fists")
 * @param minDamage   lowest raw damage roll
 * @param maxDamage   highest raw damage roll
 * @param speed       multiplier on the base attack interval (lower is faster)
 * @param damageType  type matched against armor
 * @param critChance  chance in [0,1] that a hit is critical
 * @param ranged      whether the attack reaches beyond the engaged band
 */
public record AttackProfile(String name, int minDamage, int maxDamage, double speed,
                            DamageType damageType, double critChance, boolean ranged) {

    /** Fallback used whenever a combatant has no weapon. */
    public static final AttackProfile UNARMED =
            new AttackProfile("fists", 1, 1, 1.0, DamageType.BLUDGEONING, 0.01, false);

    public AttackProfile {
        if (minDamage < 0 || maxDamage < minDamage) {
            throw new IllegalArgumentException("bad damage range " + minDamage + "-" + maxDamage);
        }
        if (speed <= 0) {
            throw new IllegalArgumentException("speed must be positive: " + speed);
        }
        if (damageType == null) damageType = DamageType.BLUDGEONING;
        critChance = Math.max(0.0, Math.min(1.0, critChance));
    }

    /**
     * Interval between automatic swings in world milliseconds.
     */
    public long intervalMillis(double baseIntervalSeconds) {
        return Math.round(baseIntervalSeconds * speed * 1000.0);
    }
}
