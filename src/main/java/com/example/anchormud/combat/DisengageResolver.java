package com.example.anchormud.combat;

import com.example.anchormud.util.OpposedCheck;

import java.util.List;
import java.util.Random;

/**
 * Contested disengage check: the disengager's avoidance against the strongest
 * opposing accuracy, or against a flat difficulty when nobody opposes.
 */
public class DisengageResolver {

    private final Random rng;
    private final int flatDifficulty;

    public DisengageResolver(Random rng, int flatDifficulty) {
        this.rng = rng;
        this.flatDifficulty = flatDifficulty;
    }

    /**
     * @param avoidance        disengager's effective avoidance
     * @param opponentAccuracy effective accuracy of each opponent still fighting it
     * @param difficultyModifier situational penalty added to the opposing side (weather)
     */
    public OpposedCheck.Result resolve(int avoidance, List<Integer> opponentAccuracy, int difficultyModifier) {
        int opposition = opposition(opponentAccuracy) + difficultyModifier;
        return OpposedCheck.contest(avoidance, opposition, rng);
    }

    public int opposition(List<Integer> opponentAccuracy) {
        if (opponentAccuracy.isEmpty()) return flatDifficulty;
        int best = Integer.MIN_VALUE;
        for (int acc : opponentAccuracy) best = Math.max(best, acc);
        return best;
    }

    public int getFlatDifficulty() {
        return flatDifficulty;
    }
}
