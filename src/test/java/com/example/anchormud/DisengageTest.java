package com.example.anchormud;

import com.example.anchormud.combat.DisengageResolver;
import com.example.anchormud.combat.FleeWindow;
import com.example.anchormud.util.OpposedCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the contested disengage check and flee windows.
 */
public class DisengageTest {

    @Test
    @DisplayName("Avoidance 100 against no effective opposition always breaks away")
    void testMaxAvoidance_AlwaysSucceeds() {
        DisengageResolver resolver = new DisengageResolver(new Random(9), 50);
        for (int i = 0; i < 500; i++) {
            assertTrue(resolver.resolve(100, List.of(0), 0).succeeded());
        }
    }

    @Test
    @DisplayName("Avoidance 0 never breaks away")
    void testZeroAvoidance_AlwaysFails() {
        DisengageResolver resolver = new DisengageResolver(new Random(9), 50);
        for (int i = 0; i < 500; i++) {
            assertFalse(resolver.resolve(0, List.of(10, 20), 0).succeeded());
        }
    }

    @Test
    void testOpposition_StrongestOpponent() {
        DisengageResolver resolver = new DisengageResolver(new Random(1), 50);
        assertEquals(70, resolver.opposition(List.of(40, 70, 55)));
    }

    @Test
    void testOpposition_FlatDifficultyWhenUnopposed() {
        DisengageResolver resolver = new DisengageResolver(new Random(1), 35);
        assertEquals(35, resolver.opposition(List.of()));
        assertEquals(35, resolver.getFlatDifficulty());
    }

    @Test
    void testDifficultyModifier_RaisesOpposition() {
        DisengageResolver resolver = new DisengageResolver(new Random(1), 50);
        OpposedCheck.Result r = resolver.resolve(60, List.of(40), 20);
        assertEquals(60, r.defenderSkill());
        assertEquals(60, r.attackerSkill());
    }

    // ========== Flee window ==========

    @Test
    void testFleeWindow_OpenUntilDeadline() {
        FleeWindow window = new FleeWindow("p:ada", "harbor_docks", 9000, List.of("e:3"));
        assertTrue(window.isOpen(0));
        assertTrue(window.isOpen(8999));
        assertFalse(window.isOpen(9000));
        assertEquals(List.of("e:3"), window.opponents());
    }
}
