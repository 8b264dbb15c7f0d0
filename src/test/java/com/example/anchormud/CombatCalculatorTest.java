package com.example.anchormud;

import com.example.anchormud.combat.CombatCalculator;
import com.example.anchormud.combat.CombatCalculator.ArmorResult;
import com.example.anchormud.combat.CombatResult;
import com.example.anchormud.combat.PlayerCombatant;
import com.example.anchormud.model.ArmorPiece;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.DamageType;
import com.example.anchormud.model.PlayerCharacter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for hit resolution, damage rolls and armor absorption.
 */
public class CombatCalculatorTest {

    private static final AttackProfile CUTLASS =
            new AttackProfile("cutlass", 2, 8, 1.0, DamageType.SLASHING, 0.1, false);

    private static ArmorPiece jerkin(int reduction, int durability) {
        return new ArmorPiece("leather jerkin", DamageType.SLASHING, EnumSet.of(DamageType.PIERCING),
                reduction, durability);
    }

    // ========== Armor ==========

    @Test
    void testApplyArmor_PrimaryType() {
        ArmorPiece piece = jerkin(3, 10);
        ArmorResult r = CombatCalculator.applyArmor(List.of(piece), DamageType.SLASHING, 5);
        assertEquals(2, r.damage());
        assertEquals(3, r.absorbed());
        assertEquals(7, piece.getDurability());
    }

    @Test
    void testApplyArmor_SecondaryTypeAtHalfRate() {
        ArmorPiece piece = jerkin(3, 10);
        ArmorResult r = CombatCalculator.applyArmor(List.of(piece), DamageType.PIERCING, 5);
        assertEquals(4, r.damage());
        assertEquals(1, r.absorbed());
        assertEquals(9, piece.getDurability());
    }

    @Test
    void testApplyArmor_UncoveredTypePassesThrough() {
        ArmorPiece piece = jerkin(3, 10);
        ArmorResult r = CombatCalculator.applyArmor(List.of(piece), DamageType.BLUDGEONING, 5);
        assertEquals(5, r.damage());
        assertEquals(0, r.absorbed());
        assertEquals(10, piece.getDurability());
    }

    @Test
    @DisplayName("Damage never drops below zero and only absorbed damage wears the armor")
    void testApplyArmor_NeverNegative() {
        ArmorPiece piece = jerkin(5, 10);
        ArmorResult r = CombatCalculator.applyArmor(List.of(piece), DamageType.SLASHING, 2);
        assertEquals(0, r.damage());
        assertEquals(2, r.absorbed());
        assertEquals(8, piece.getDurability());
    }

    @Test
    void testApplyArmor_ReductionCappedByDurability() {
        ArmorPiece piece = jerkin(5, 1);
        ArmorResult r = CombatCalculator.applyArmor(List.of(piece), DamageType.SLASHING, 5);
        assertEquals(4, r.damage());
        assertTrue(piece.isBroken());
        // a broken piece stays on but stops helping
        ArmorResult again = CombatCalculator.applyArmor(List.of(piece), DamageType.SLASHING, 5);
        assertEquals(5, again.damage());
    }

    @Test
    void testApplyArmor_PiecesApplyInOrder() {
        ArmorPiece first = jerkin(2, 10);
        ArmorPiece second = new ArmorPiece("buckler", DamageType.SLASHING, Set.of(), 4, 10);
        ArmorResult r = CombatCalculator.applyArmor(List.of(first, second), DamageType.SLASHING, 5);
        assertEquals(0, r.damage());
        assertEquals(8, first.getDurability());
        assertEquals(7, second.getDurability());
    }

    // ========== Damage rolls ==========

    @Test
    void testRollRawDamage_WithinRange() {
        CombatCalculator calc = new CombatCalculator(new Random(11));
        for (int i = 0; i < 500; i++) {
            int dmg = calc.rollRawDamage(CUTLASS, 1.0);
            assertTrue(dmg >= 2 && dmg <= 8, "damage out of range: " + dmg);
        }
    }

    @Test
    void testRollRawDamage_Multiplier() {
        CombatCalculator calc = new CombatCalculator(new Random(11));
        AttackProfile fixed = new AttackProfile("club", 4, 4, 1.0, DamageType.BLUDGEONING, 0, false);
        assertEquals(7, calc.rollRawDamage(fixed, 1.75));
        assertEquals(3, calc.rollRawDamage(fixed, 0.75));
    }

    @Test
    void testRollInitiative_Range() {
        CombatCalculator calc = new CombatCalculator(new Random(5));
        PlayerCombatant c = new PlayerCombatant(new PlayerCharacter("Ada", 20, 10, 50, 50, 3));
        for (int i = 0; i < 200; i++) {
            int roll = calc.rollInitiative(c);
            assertTrue(roll >= 4 && roll <= 23, "initiative out of range: " + roll);
        }
    }

    // ========== Full attacks ==========

    @Test
    @DisplayName("Resolved damage stays between zero and the raw roll, and armor loses what it absorbed")
    void testResolveAttack_DamageAndDurabilityBounds() {
        CombatCalculator calc = new CombatCalculator(new Random(42));
        PlayerCharacter attackerPc = new PlayerCharacter("Attacker", 30, 10, 80, 40, 0);
        PlayerCharacter defenderPc = new PlayerCharacter("Defender", 1000, 10, 40, 40, 0);
        ArmorPiece armor = jerkin(2, 10_000);
        defenderPc.equipArmor(armor);
        PlayerCombatant attacker = new PlayerCombatant(attackerPc);
        PlayerCombatant defender = new PlayerCombatant(defenderPc);

        int hits = 0;
        for (int i = 0; i < 500; i++) {
            int before = armor.getDurability();
            CombatResult r = calc.resolveAttack(attacker, defender, CUTLASS, 80, 40, 1.0);
            int lost = before - armor.getDurability();
            assertTrue(r.getDamage() >= 0);
            assertTrue(r.getDamage() <= r.getRawDamage() || !r.isHit());
            assertEquals(r.getAbsorbed(), lost);
            if (r.isHit()) {
                hits++;
                assertEquals(r.getRawDamage() - r.getAbsorbed(), r.getDamage());
            } else {
                assertEquals(0, lost);
            }
        }
        assertTrue(hits > 0, "an 80 vs 40 attacker should land some hits");
        assertEquals(1000, defenderPc.getHp(), "resolving an attack must not touch hit points");
    }

    @Test
    void testResolveAttack_ZeroAccuracyAlwaysMisses() {
        CombatCalculator calc = new CombatCalculator(new Random(1));
        PlayerCombatant attacker = new PlayerCombatant(new PlayerCharacter("Attacker", 30, 10, 0, 40, 0));
        PlayerCombatant defender = new PlayerCombatant(new PlayerCharacter("Defender", 30, 10, 40, 40, 0));
        for (int i = 0; i < 200; i++) {
            CombatResult r = calc.resolveAttack(attacker, defender, CUTLASS, 0, 40, 1.0);
            assertFalse(r.isHit());
            assertEquals(CombatResult.ResultType.MISS, r.getType());
        }
    }
}
