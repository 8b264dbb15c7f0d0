package com.example.anchormud;

import com.example.anchormud.combat.Combat;
import com.example.anchormud.combat.Combat.InitiativeRoll;
import com.example.anchormud.combat.CombatParticipant;
import com.example.anchormud.combat.CombatState;
import com.example.anchormud.combat.Combatant;
import com.example.anchormud.combat.ParticipantState;
import com.example.anchormud.combat.PlayerCombatant;
import com.example.anchormud.model.PlayerCharacter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-room combat session: initiative order, late joiners and rounds.
 */
public class CombatSessionTest {

    private static Combatant fighter(String name) {
        return new PlayerCombatant(new PlayerCharacter(name, 20, 10, 50, 50, 0));
    }

    private static List<String> queueRefs(Combat combat) {
        return combat.actionQueue().stream().map(CombatParticipant::getRef).collect(Collectors.toList());
    }

    @Test
    void testStart_SortsByRollDescending() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Ada"), 7),
                new InitiativeRoll(fighter("Bo"), 15),
                new InitiativeRoll(fighter("Cy"), 11)), 0);
        assertEquals(List.of("p:bo", "p:cy", "p:ada"), combat.getInitiativeOrder());
        for (CombatParticipant p : combat.getParticipants()) {
            assertEquals(ParticipantState.ENGAGED, p.getState());
            assertFalse(p.isLateJoiner());
        }
    }

    @Test
    void testStart_TiesBrokenByRef() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Zed"), 10),
                new InitiativeRoll(fighter("Ada"), 10)), 0);
        assertEquals(List.of("p:ada", "p:zed"), combat.getInitiativeOrder());
    }

    @Test
    @DisplayName("Late joiners act after the initiative order and never reorder it")
    void testLateJoiners_AppendedAfterInitiative() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Ada"), 5),
                new InitiativeRoll(fighter("Bo"), 9)), 0);
        List<String> order = combat.getInitiativeOrder();

        combat.addLateJoiner("p:cy", ParticipantState.ENGAGED);
        combat.addLateJoiner("p:dee", ParticipantState.SUPPORTING);

        assertEquals(order, combat.getInitiativeOrder());
        assertEquals(List.of("p:bo", "p:ada", "p:cy", "p:dee"), queueRefs(combat));
        assertTrue(combat.getParticipant("p:cy").isLateJoiner());
        assertEquals(ParticipantState.SUPPORTING, combat.getParticipant("p:dee").getState());
    }

    @Test
    void testRejoin_KeepsOriginalSlot() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Ada"), 5),
                new InitiativeRoll(fighter("Bo"), 9)), 0);
        combat.addLateJoiner("p:cy", ParticipantState.ENGAGED);
        combat.removeParticipant("p:ada");
        combat.removeParticipant("p:cy");
        assertEquals(List.of("p:bo"), queueRefs(combat));

        combat.addLateJoiner("p:cy", ParticipantState.ENGAGED);
        combat.addLateJoiner("p:ada", ParticipantState.ENGAGED);
        assertEquals(List.of("p:bo", "p:ada", "p:cy"), queueRefs(combat));
    }

    @Test
    void testAddLateJoiner_ExistingParticipantUnchanged() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Ada"), 5),
                new InitiativeRoll(fighter("Bo"), 9)), 0);
        CombatParticipant before = combat.getParticipant("p:ada");
        assertSame(before, combat.addLateJoiner("p:ada", ParticipantState.SUPPORTING));
        assertEquals(ParticipantState.ENGAGED, before.getState());
    }

    // ========== Rounds ==========

    @Test
    @DisplayName("Participants are handed out as a snapshot that later changes do not touch")
    void testGetParticipants_IsSnapshot() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Ada"), 5),
                new InitiativeRoll(fighter("Bo"), 9)), 0);
        Collection<CombatParticipant> seen = combat.getParticipants();

        combat.addLateJoiner("p:cy", ParticipantState.ENGAGED);
        combat.removeParticipant("p:ada");

        assertEquals(2, seen.size());
        assertTrue(seen.stream().anyMatch(p -> p.getRef().equals("p:ada")));
        assertEquals(2, combat.getParticipants().size());
        assertThrows(UnsupportedOperationException.class, () -> seen.clear());
    }

    @Test
    void testRounds_DueAfterWindow() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Ada"), 5),
                new InitiativeRoll(fighter("Bo"), 9)), 1000);
        assertFalse(combat.isRoundDue(3999, 3000));
        assertTrue(combat.isRoundDue(4000, 3000));
        combat.advanceRound(4000);
        assertEquals(2, combat.getCurrentRound());
        assertFalse(combat.isRoundDue(6999, 3000));
    }

    @Test
    void testEnd_StopsRounds() {
        Combat combat = Combat.start(1, "harbor_docks", List.of(
                new InitiativeRoll(fighter("Ada"), 5),
                new InitiativeRoll(fighter("Bo"), 9)), 0);
        combat.end();
        assertEquals(CombatState.ENDED, combat.getState());
        assertFalse(combat.isActive());
        assertFalse(combat.isRoundDue(100_000, 3000));
    }
}
