package com.example.anchormud.combat;

import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.DamageType;
import com.example.anchormud.util.OpposedCheck;

import java.util.List;
import java.util.Random;

/**
 * Combat calculator for hit contests, damage rolls and armor.
 *
 * Hit: accuracy-vs-avoidance contest ({@link OpposedCheck}). A glancing
 * success deals half damage (minimum 1).
 *
 * Damage: raw roll in [min, max] times the maneuver multiplier, doubled on a
 * critical. Armor then reduces it piece by piece; each piece loses durability
 * equal to what it absorbed, and damage never drops below zero.
 */
public class CombatCalculator {

    public static final int CRITICAL_MULTIPLIER = 2;

    /** Damage remaining after armor, and how much the armor absorbed. */
    public record ArmorResult(int damage, int absorbed) {}

    private final Random rng;

    public CombatCalculator(Random rng) {
        this.rng = rng;
    }

    /**
     * Resolve one attack. Armor durability is consumed here; hit points are not
     * touched (damage is applied in the resolution phase).
     *
     * @param attackerSkill effective accuracy including all situational modifiers
     * @param defenderSkill effective avoidance including all situational modifiers
     */
    public CombatResult resolveAttack(Combatant attacker, Combatant defender, AttackProfile attack,
                                      int attackerSkill, int defenderSkill, double damageMultiplier) {
        OpposedCheck.Result check = OpposedCheck.contest(attackerSkill, defenderSkill, rng);
        if (!check.succeeded()) {
            return CombatResult.miss(attacker, defender).withRolls(check.attackerRoll(), check.defenderRoll());
        }

        int raw = rollRawDamage(attack, damageMultiplier);
        boolean critical = rng.nextDouble() < attack.critChance();
        boolean glancing = check.outcome() == OpposedCheck.Outcome.GLANCING;
        if (critical) {
            raw *= CRITICAL_MULTIPLIER;
        } else if (glancing && raw > 0) {
            raw = Math.max(1, raw / 2);
        }

        ArmorResult armor = applyArmor(defender.getArmor(), attack.damageType(), raw);
        CombatResult result;
        if (critical) {
            result = CombatResult.criticalHit(attacker, defender, raw, armor.damage(), armor.absorbed());
        } else if (glancing) {
            result = CombatResult.glancingBlow(attacker, defender, raw, armor.damage(), armor.absorbed());
        } else {
            result = CombatResult.hit(attacker, defender, raw, armor.damage(), armor.absorbed());
        }
        return result.withRolls(check.attackerRoll(), check.defenderRoll());
    }

    /**
     * Roll raw damage within the attack's range, scaled by the multiplier.
     */
    public int rollRawDamage(AttackProfile attack, double damageMultiplier) {
        int spread = attack.maxDamage() - attack.minDamage();
        int base = attack.minDamage() + (spread > 0 ? rng.nextInt(spread + 1) : 0);
        if (damageMultiplier == 1.0) {
            return base;
        }
        return (int) Math.max(0, Math.round(base * damageMultiplier));
    }

    /**
     * Apply armor in equip order. Each piece soaks up to its reduction against
     * the damage type and loses exactly that much durability.
     */
    public static ArmorResult applyArmor(List<ArmorPiece> armor, DamageType type, int damage) {
        int remaining = Math.max(0, damage);
        int absorbed = 0;
        for (ArmorPiece piece : armor) {
            if (remaining == 0) break;
            int soak = Math.min(piece.reductionAgainst(type), remaining);
            if (soak > 0) {
                piece.absorb(soak);
                remaining -= soak;
                absorbed += soak;
            }
        }
        return new ArmorResult(remaining, absorbed);
    }

    /**
     * Initiative roll: d20 plus bonus.
     */
    public int rollInitiative(Combatant combatant) {
        return 1 + rng.nextInt(20) + combatant.getInitiativeBonus();
    }
}
