package com.example.anchormud;

import com.example.anchormud.util.OpposedCheck;
import com.example.anchormud.util.OpposedCheck.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the d100 contest used by attacks and disengage.
 */
public class OpposedCheckTest {

    // ========== Verdict table ==========

    @ParameterizedTest
    @CsvSource({
            // attRoll, defRoll, attSkill, defSkill, outcome
            "60, 10, 50, 50, FAIL",       // attacker missed their own roll
            "30, 70, 50, 50, SUCCESS",    // defender failed
            "20, 30, 50, 50, SUCCESS",    // both succeed, defender rolled low in band
            "20, 45, 50, 50, GLANCING",   // both succeed, defender near the top of their skill
            "40, 30, 50, 50, FAIL",       // both succeed, defender rolled lower
            "30, 30, 50, 50, FAIL",       // ties go to the defender
            "1, 100, 1, 100, GLANCING",
            "100, 1, 100, 0, SUCCESS"
    })
    void testJudge_Table(int attRoll, int defRoll, int attSkill, int defSkill, Outcome expected) {
        assertEquals(expected, OpposedCheck.judge(attRoll, defRoll, attSkill, defSkill));
    }

    // ========== Clamping and extremes ==========

    @Test
    void testClampSkill() {
        assertEquals(0, OpposedCheck.clampSkill(-20));
        assertEquals(100, OpposedCheck.clampSkill(140));
        assertEquals(37, OpposedCheck.clampSkill(37));
    }

    @Test
    @DisplayName("Skill 100 against skill 0 always succeeds")
    void testMaxSkillAgainstZero_AlwaysSucceeds() {
        Random rng = new Random(7);
        for (int i = 0; i < 1000; i++) {
            assertTrue(OpposedCheck.contest(100, 0, rng).succeeded());
        }
    }

    @Test
    @DisplayName("Skill 0 never succeeds")
    void testZeroSkill_AlwaysFails() {
        Random rng = new Random(7);
        for (int i = 0; i < 1000; i++) {
            assertFalse(OpposedCheck.contest(0, 0, rng).succeeded());
        }
    }

    @Test
    void testD100_Range() {
        Random rng = new Random(3);
        for (int i = 0; i < 1000; i++) {
            int roll = OpposedCheck.d100(rng);
            assertTrue(roll >= 1 && roll <= 100, "roll out of range: " + roll);
        }
    }

    @Test
    void testContest_RecordsClampedSkills() {
        OpposedCheck.Result r = OpposedCheck.contest(150, -5, new Random(1));
        assertEquals(100, r.attackerSkill());
        assertEquals(0, r.defenderSkill());
    }
}
