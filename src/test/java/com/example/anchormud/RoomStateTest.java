package com.example.anchormud;

import com.example.anchormud.model.RoomState;
import com.example.anchormud.model.RuleTimer;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.world.EntityRegistry;
import com.example.anchormud.world.RoomStateManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for per-room runtime state and its manager.
 */
public class RoomStateTest {

    // ========== Rule timers ==========

    @Test
    void testTryConsume_RespectsCooldown() {
        RoomState state = new RoomState("net_sheds", 7, 0, 60_000);
        assertEquals(1, state.tryConsumeSpawn("shed_rats", 0, 10_000, 3, 1));
        assertEquals(0, state.tryConsumeSpawn("shed_rats", 9_999, 10_000, 3, 1));
        assertEquals(1, state.tryConsumeSpawn("shed_rats", 10_000, 10_000, 3, 1));
        assertEquals(2, state.spawnTimer("shed_rats").alive());
    }

    @Test
    void testTryConsume_CappedByMaxAlive() {
        RoomState state = new RoomState("net_sheds", 7, 0, 60_000);
        assertEquals(2, state.tryConsumeSpawn("r", 0, 0, 2, 5));
        assertEquals(0, state.tryConsumeSpawn("r", 1, 0, 2, 1));
        state.releaseSpawn("r", 1);
        assertEquals(1, state.tryConsumeSpawn("r", 2, 0, 2, 5));
    }

    @Test
    void testTimers_FreshUntilFirstFire() {
        RoomState state = new RoomState("net_sheds", 7, 0, 60_000);
        assertSame(RuleTimer.FRESH, state.spawnTimer("never"));
        assertSame(RuleTimer.FRESH, state.lootTimer("never"));
    }

    @Test
    void testRelease_NeverBelowZero() {
        RoomState state = new RoomState("net_sheds", 7, 0, 60_000);
        state.tryConsumeLoot("rope", 0, 0, 1, 1);
        state.releaseLoot("rope", 5);
        assertEquals(0, state.lootTimer("rope").alive());
    }

    @Test
    @DisplayName("Racing claims fire a rule at most once per cooldown")
    void testTryConsume_ConcurrentClaimsFireOnce() throws InterruptedException {
        RoomState state = new RoomState("black_anchor_cellar", 7, 0, 60_000);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                go.await();
                granted.addAndGet(state.tryConsumeSpawn("cellar_rats", 1000, 300_000, 10, 1));
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1, granted.get());
    }

    @Test
    void testEncounterRollClaim_Cooldown() {
        RoomState state = new RoomState("harbor_docks", 7, 0, 60_000);
        assertTrue(state.tryClaimEncounterRoll(0, 1000));
        assertFalse(state.tryClaimEncounterRoll(999, 1000));
        assertTrue(state.tryClaimEncounterRoll(1000, 1000));
    }

    // ========== Manager ==========

    @Test
    void testManager_CreatesLazilyAndTouches() {
        ManualTimeSource time = new ManualTimeSource();
        GameClock clock = new GameClock(time, 1, 100);
        RoomStateManager rooms = new RoomStateManager(clock, new EntityRegistry(), 10_000, 60_000);
        assertNull(rooms.get("pier_end"));
        RoomState state = rooms.getOrCreate("pier_end");
        assertSame(state, rooms.getOrCreate("pier_end"));
        time.advance(500);
        rooms.getOrCreate("pier_end");
        assertEquals(clock.nowMillis(), state.getLastActiveAt());
        assertEquals(1, rooms.size());
    }

    @Test
    void testManager_DiscardsIdleEmptyRoom() {
        ManualTimeSource time = new ManualTimeSource();
        GameClock clock = new GameClock(time, 1, 100);
        RoomStateManager rooms = new RoomStateManager(clock, new EntityRegistry(), 10_000, 60_000);
        rooms.getOrCreate("pier_end");
        time.advance(5_000);
        assertFalse(rooms.removeIfIdle("pier_end"));
        time.advance(5_000);
        assertTrue(rooms.removeIfIdle("pier_end"));
        assertNull(rooms.get("pier_end"));
    }

    @Test
    void testManager_ResetRefreshesSeedAfterInterval() {
        ManualTimeSource time = new ManualTimeSource();
        GameClock clock = new GameClock(time, 1, 100);
        RoomStateManager rooms = new RoomStateManager(clock, new EntityRegistry(), 10_000, 60_000);
        RoomState state = rooms.getOrCreate("harbor_docks");
        state.tryConsumeSpawn("dock_gulls", clock.nowMillis(), 0, 3, 2);
        assertFalse(rooms.maybeReset("harbor_docks"));
        time.advance(60_000);
        assertTrue(rooms.maybeReset("harbor_docks"));
        assertEquals(clock.nowMillis() + 60_000, state.getNextResetAt());
        // live instances still count after a reset
        assertEquals(2, state.spawnTimer("dock_gulls").alive());
    }
}
