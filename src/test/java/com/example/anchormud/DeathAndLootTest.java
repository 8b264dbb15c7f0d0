package com.example.anchormud;

import com.example.anchormud.combat.ActionOutcome;
import com.example.anchormud.combat.AttackTicker;
import com.example.anchormud.model.CombatantInstance;
import com.example.anchormud.model.Direction;
import com.example.anchormud.model.ItemInstance;
import com.example.anchormud.model.PlayerCharacter;
import com.example.anchormud.net.MessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A creature killed in combat is removed in the same step, its loot table is
 * rolled exactly once and the drops are held for the killer.
 */
public class DeathAndLootTest {

    private static final String CELLAR = "black_anchor_cellar";

    private TestWorld world;
    private String alice;
    private String bob;
    private String rat;

    @BeforeEach
    void setUp() {
        world = new TestWorld();
        alice = world.connect("Alice");
        bob = world.connect("Bob");
        world.toughen(alice, 100, 100);
        world.runtime.move(alice, Direction.DOWN);
        world.runtime.move(bob, Direction.DOWN);
        rat = world.runtime.resolveTarget(alice, "rat");
        world.runtime.getRegistry().getCombatantInstance(rat).setHp(1);
    }

    @AfterEach
    void tearDown() {
        world.shutdown();
    }

    private void killRat() {
        assertTrue(world.runtime.getCombat().attack(alice, rat).isAccepted());
        assertTrue(world.runUntil(() -> world.runtime.getRegistry().getInstance(rat) == null, 60_000),
                "the rat should die");
    }

    @Test
    void testKill_RemovesVictimAndEndsCombat() {
        int aliveBefore = world.runtime.getRooms().get(CELLAR).spawnTimer("cellar_rats").alive();
        killRat();

        assertNull(world.runtime.getRegistry().positionOf(rat));
        assertEquals(aliveBefore - 1, world.runtime.getRooms().get(CELLAR).spawnTimer("cellar_rats").alive());
        assertFalse(world.runtime.getCombat().isInCombat(alice));
        assertNull(world.runtime.getCombat().getTickers().get(alice));
        assertTrue(world.saw(alice, "a dock rat is slain!"));
        assertTrue(world.saw(bob, "a dock rat is slain!"), "bystanders see the death");
        assertTrue(world.messages(alice).stream().anyMatch(m -> m.type() == MessageType.ROUND_SUMMARY));
    }

    @Test
    @DisplayName("When the target dies the killer's ticker restarts on a fresh phase against the next opponent")
    void testKill_TickerRestartsOnNextOpponent() {
        CombatantInstance other = world.runtime.getLocks().withRoom(CELLAR,
                () -> world.runtime.getSpawns().createCombatant("dock_rat", CELLAR, null, null, 0));
        String survivor = other.getRef();
        assertTrue(world.runtime.getCombat().attack(alice, survivor).isAccepted());
        assertTrue(world.runtime.getCombat().attack(alice, rat).isAccepted());
        AttackTicker before = world.runtime.getCombat().getTickers().get(alice);
        assertEquals(rat, before.getTargetRef());

        assertTrue(world.runUntil(() -> world.runtime.getRegistry().getInstance(rat) == null, 60_000),
                "the rat should die");

        assertTrue(before.isCancelled(), "the old ticker must not keep its phase");
        AttackTicker after = world.runtime.getCombat().getTickers().get(alice);
        assertNotNull(after, "Alice turns on the rat still attacking her");
        assertNotSame(before, after);
        assertEquals(survivor, after.getTargetRef());
        assertTrue(after.getNextFireAt() > world.clock.nowMillis());
        assertEquals(0, after.getFireCount());
        assertTrue(world.runtime.getCombat().isInCombat(alice));
    }

    @Test
    void testKill_LootRolledOnce() {
        killRat();
        assertEquals(1, world.runtime.getSpawns().getLootRollCount());

        List<ItemInstance> floor = world.runtime.getRegistry().itemsInRoom(CELLAR);
        ItemInstance tail = floor.stream().filter(i -> i.getTemplateId().equals("rat_tail")).findFirst().orElseThrow();
        assertEquals(world.runtime.getSessions().sessionIdFor(alice), tail.getReservedFor());

        // later rounds never roll the same corpse again
        world.advance(10_000);
        assertEquals(1, world.runtime.getSpawns().getLootRollCount());
    }

    @Test
    void testKill_DropsReservedForKiller() {
        killRat();

        ActionOutcome denied = world.runtime.pickUp(bob, "tail");
        assertEquals(ActionOutcome.Status.NOT_ALLOWED, denied.getStatus());

        ActionOutcome taken = world.runtime.pickUp(alice, "tail");
        assertTrue(taken.isAccepted(), taken.toString());
        PlayerCharacter pc = world.player(alice);
        assertEquals(Integer.valueOf(1), pc.getInventory().get("rat_tail"));
        assertTrue(world.runtime.getRegistry().itemsInRoom(CELLAR).stream()
                .noneMatch(i -> i.getTemplateId().equals("rat_tail")));
    }

    @Test
    void testKill_ReservationLapses() {
        killRat();
        world.advance(61_000);
        assertTrue(world.runtime.pickUp(bob, "tail").isAccepted());
    }

    @Test
    void testDeadTargetCannotBeAttacked() {
        killRat();
        for (CombatantInstance c : world.runtime.getRegistry().combatantsInRoom(CELLAR)) {
            assertNotEquals(rat, c.getRef());
        }
        assertEquals(ActionOutcome.Status.INVALID_TARGET, world.runtime.getCombat().attack(alice, rat).getStatus());
    }

    @Test
    void testPlayerDefeat_RespawnsAtHalfHealth() {
        PlayerCharacter pc = world.player(bob);
        pc.setAccuracy(0);
        pc.setAvoidance(0);
        pc.setHp(1);
        assertTrue(world.runtime.getCombat().attack(bob, rat).isAccepted());
        assertTrue(world.runUntil(() -> world.saw(bob, "You have been defeated!"), 60_000));

        assertEquals(world.runtime.getRespawnRoomId(), world.runtime.getRegistry().roomOf(bob));
        assertEquals(pc.getMaxHp() / 2, pc.getHp());
        assertFalse(world.runtime.getCombat().isInCombat(bob));
    }
}
