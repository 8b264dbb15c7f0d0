package com.example.anchormud;

import com.example.anchormud.combat.ActionOutcome;
import com.example.anchormud.combat.ParticipantState;
import com.example.anchormud.combat.PursuitResolver;
import com.example.anchormud.combat.PursuitResolver.Decision;
import com.example.anchormud.combat.PursuitResolver.Verdict;
import com.example.anchormud.model.CreatureInstance;
import com.example.anchormud.model.CreatureTemplate;
import com.example.anchormud.model.Direction;
import com.example.anchormud.model.Room;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Creatures chasing a combatant who broke away: who follows, how far, and
 * when they give up and go home.
 */
public class PursuitTest {

    private static final String DOCKS = "harbor_docks";
    private static final String SHEDS = "net_sheds";
    private static final String PIER = "pier_end";
    private static final String BILGE = "bilge_stairs";
    private static final String COMMON = "black_anchor_common";

    private final PursuitResolver resolver = new PursuitResolver();
    private TestWorld world;

    @AfterEach
    void tearDown() {
        if (world != null) world.shutdown();
    }

    private static Room room(String id) {
        return TestWorld.CONTENT.requireRoom(id);
    }

    private static CreatureInstance creature(String templateId, String originRoomId) {
        CreatureTemplate template = (CreatureTemplate) TestWorld.CONTENT.getCombatTemplate(templateId);
        return new CreatureInstance(1, template, 0, 0, originRoomId, null, null);
    }

    // ========== Resolver ==========

    @Test
    void testResolver_ShortPursuitFollowsOneRoom() {
        CreatureInstance rat = creature("dock_rat", SHEDS);
        Decision decision = resolver.evaluate(rat, room(SHEDS), room(DOCKS), 1_000);
        assertEquals(Verdict.FOLLOWS, decision.verdict());
    }

    @Test
    void testResolver_NonPursuerStays() {
        CreatureInstance gull = creature("harbor_gull", DOCKS);
        assertEquals(Verdict.STAYS, resolver.evaluate(gull, room(DOCKS), room(SHEDS), 1_000).verdict());
    }

    @Test
    void testResolver_SafeDestinationStays() {
        CreatureInstance rat = creature("dock_rat", DOCKS);
        Decision decision = resolver.evaluate(rat, room(DOCKS), room(COMMON), 1_000);
        assertEquals(Verdict.STAYS, decision.verdict());
        assertEquals("destination closed to creatures", decision.reason());
    }

    @Test
    @DisplayName("A no-pursuit room on either side stops the chase")
    void testResolver_NoPursuitRoomBlocks() {
        CreatureInstance rat = creature("dock_rat", SHEDS);
        Decision into = resolver.evaluate(rat, room(SHEDS), room(BILGE), 1_000);
        assertEquals(Verdict.STAYS, into.verdict());
        assertEquals("pursuit blocked by room", into.reason());

        CreatureInstance smuggler = creature("smuggler", BILGE);
        Decision outOf = resolver.evaluate(smuggler, room(BILGE), room(SHEDS), 1_000);
        assertEquals(Verdict.STAYS, outOf.verdict());
        assertEquals("pursuit blocked by room", outOf.reason());
    }

    @Test
    @DisplayName("One room past the leash radius sends an away creature home")
    void testResolver_RoomLeashReturnsHome() {
        CreatureInstance rat = creature("dock_rat", SHEDS);
        rat.notePursuitStep(1_000);
        Decision decision = resolver.evaluate(rat, room(DOCKS), room(PIER), 2_000);
        assertEquals(Verdict.RETURNS_HOME, decision.verdict());
        assertEquals("leash", decision.reason());

        Decision home = resolver.evaluate(rat, room(DOCKS), room(SHEDS), 2_000);
        assertEquals(Verdict.FOLLOWS, home.verdict(), "heading back toward its origin is always inside the leash");
    }

    @Test
    void testResolver_LeashAtOriginStaysPut() {
        CreatureInstance smuggler = creature("smuggler", DOCKS);
        smuggler.notePursuitStep(0);
        smuggler.notePursuitStep(0);
        smuggler.notePursuitStep(0);
        assertEquals(Verdict.STAYS, resolver.evaluate(smuggler, room(DOCKS), room(PIER), 1_000).verdict());
    }

    @Test
    void testResolver_TimeLeash() {
        CreatureInstance smuggler = creature("smuggler", PIER);
        long start = 10_000;
        smuggler.notePursuitStep(start);

        assertEquals(Verdict.FOLLOWS, resolver.evaluate(smuggler, room(DOCKS), room(SHEDS), start + 90_000).verdict());
        assertFalse(PursuitResolver.leashExpired(smuggler, start + 90_000));

        assertEquals(Verdict.RETURNS_HOME,
                resolver.evaluate(smuggler, room(DOCKS), room(SHEDS), start + 91_000).verdict());
        assertTrue(PursuitResolver.leashExpired(smuggler, start + 91_000));

        smuggler.clearPursuit();
        assertFalse(PursuitResolver.leashExpired(smuggler, start + 91_000));
    }

    // ========== Runtime ==========

    private void breakAway(String ref) {
        for (int attempt = 0; attempt < 30; attempt++) {
            ActionOutcome outcome = world.runtime.disengage(ref);
            assertTrue(outcome.isAccepted(), "attempt " + attempt + ": " + outcome);
            world.runUntil(() -> world.runtime.getCombat().getState(ref) != ParticipantState.DISENGAGING, 4_000);
            if (world.runtime.getCombat().getFleeWindow(ref) != null) return;
        }
        fail("never broke away");
    }

    /** Alice walks to the net sheds and picks a fight with the rat there. */
    private String fightShedRat(String alice) {
        world.toughen(alice, 0, 100);
        assertTrue(world.runtime.move(alice, Direction.NORTH).isAccepted());
        assertTrue(world.runtime.move(alice, Direction.EAST).isAccepted());
        String rat = world.runtime.resolveTarget(alice, "rat");
        assertNotNull(rat, "the sheds should have a rat");
        assertTrue(world.runtime.attack(alice, "rat").isAccepted());
        return rat;
    }

    @Test
    @DisplayName("A rat follows a fleeing fighter and picks the fight back up")
    void testRuntime_CreatureFollows() {
        world = new TestWorld();
        String alice = world.connect("Alice");
        String rat = fightShedRat(alice);

        breakAway(alice);
        assertTrue(world.runtime.move(alice, Direction.WEST).isAccepted());

        assertEquals(DOCKS, world.runtime.getRegistry().roomOf(rat));
        assertTrue(world.saw(alice, "follows you!"));
        assertTrue(world.runtime.getCombat().isInCombat(alice));
        assertTrue(world.runtime.getRegistry().getCombatantInstance(rat).isPursuing());
        assertEquals(ActionOutcome.Status.NOT_ALLOWED, world.runtime.move(alice, Direction.NORTH).getStatus());
    }

    @Test
    @DisplayName("A pursuer past its leash time breaks off and goes home")
    void testRuntime_TimeLeashReturnsHome() {
        world = new TestWorld();
        String alice = world.connect("Alice");
        String rat = fightShedRat(alice);
        breakAway(alice);
        world.runtime.move(alice, Direction.WEST);
        assertEquals(DOCKS, world.runtime.getRegistry().roomOf(rat));

        assertTrue(world.runUntil(() -> SHEDS.equals(world.runtime.getRegistry().roomOf(rat)), 40_000),
                "the rat should give up after its leash time");
        assertTrue(world.saw(alice, "breaks off and slinks away."));
        assertFalse(world.runtime.getRegistry().getCombatantInstance(rat).isPursuing());
        assertFalse(world.runtime.getCombat().isInCombat(rat));
    }

    @Test
    @DisplayName("Running one room past the leash radius sends the pursuer home")
    void testRuntime_RoomLeashReturnsHome() {
        world = new TestWorld();
        String alice = world.connect("Alice");
        String rat = fightShedRat(alice);
        breakAway(alice);
        world.runtime.move(alice, Direction.WEST);
        assertEquals(DOCKS, world.runtime.getRegistry().roomOf(rat));

        breakAway(alice);
        assertTrue(world.runtime.move(alice, Direction.NORTH).isAccepted());

        assertEquals(PIER, world.runtime.getRegistry().roomOf(alice));
        assertNotEquals(PIER, world.runtime.getRegistry().roomOf(rat));
        assertTrue(world.runUntil(() -> SHEDS.equals(world.runtime.getRegistry().roomOf(rat)), 1_000));
    }

    @Test
    void testRuntime_NoPursuitRoomStopsChase() {
        world = new TestWorld();
        String alice = world.connect("Alice");
        String rat = fightShedRat(alice);
        breakAway(alice);

        assertTrue(world.runtime.move(alice, Direction.DOWN).isAccepted());

        assertEquals(BILGE, world.runtime.getRegistry().roomOf(alice));
        assertEquals(SHEDS, world.runtime.getRegistry().roomOf(rat));
        assertFalse(world.saw(alice, "follows you!"));
        assertFalse(world.runtime.getRegistry().getCombatantInstance(rat).isPursuing());
    }
}
