package com.example.anchormud.util;

import java.util.Random;

/**
 * d100 skill contests between two parties.
 *
 * Both sides roll d100 against their effective skill (0-100, rolling at or
 * under the skill succeeds). The attacker wins when their roll succeeds and
 * the defender either fails or rolls higher than the attacker. Equal rolls go
 * to the defender.
 */
public final class OpposedCheck {

    /** A defender success within this fraction of the top of their skill is a glancing save. */
    public static final double GLANCING_BAND = 0.8;

    public enum Outcome {
        /** Attacker failed their own roll or was beaten. */
        FAIL,
        /** Clean success. */
        SUCCESS,
        /** Success, but the defender's roll was a near save. */
        GLANCING
    }

    /**
     * Rolls and verdict of one contest.
     */
    public record Result(int attackerRoll, int defenderRoll, int attackerSkill, int defenderSkill, Outcome outcome) {
        public boolean succeeded() {
            return outcome != Outcome.FAIL;
        }
    }

    private OpposedCheck() {
    }

    public static int clampSkill(int skill) {
        return Math.max(0, Math.min(100, skill));
    }

    public static int d100(Random rng) {
        return rng.nextInt(100) + 1;
    }

    /**
     * Run a contest between clamped skills.
     */
    public static Result contest(int attackerSkill, int defenderSkill, Random rng) {
        int att = clampSkill(attackerSkill);
        int def = clampSkill(defenderSkill);
        int attRoll = d100(rng);
        int defRoll = d100(rng);
        return new Result(attRoll, defRoll, att, def, judge(attRoll, defRoll, att, def));
    }

    /**
     * Verdict for given rolls. Exposed for table-driven tests.
     */
    public static Outcome judge(int attRoll, int defRoll, int attackerSkill, int defenderSkill) {
        if (attRoll > attackerSkill) {
            return Outcome.FAIL;
        }
        boolean defenderSucceeded = defRoll <= defenderSkill;
        if (!defenderSucceeded) {
            return Outcome.SUCCESS;
        }
        if (attRoll < defRoll) {
            return defRoll >= GLANCING_BAND * defenderSkill ? Outcome.GLANCING : Outcome.SUCCESS;
        }
        return Outcome.FAIL;
    }
}
