package com.example.anchormud;

import com.example.anchormud.combat.AttackTicker;
import com.example.anchormud.combat.AttackTickerService;
import com.example.anchormud.combat.AttackTickerService.StartResult;
import com.example.anchormud.event.EventScheduler;
import com.example.anchormud.model.AttackProfile;
import com.example.anchormud.model.DamageType;
import com.example.anchormud.util.GameClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for per-combatant attack tickers driven by the event scheduler.
 */
public class AttackTickerTest {

    private ManualTimeSource time;
    private GameClock clock;
    private EventScheduler scheduler;
    private AttackTickerService tickers;
    private final List<Long> fireTimes = new ArrayList<>();
    private final List<String> fireTargets = new ArrayList<>();

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource();
        clock = new GameClock(time, 1, 0);
        scheduler = new EventScheduler(clock);
        tickers = new AttackTickerService(clock, scheduler);
        tickers.setFireHandler(t -> {
            fireTimes.add(t.getNextFireAt());
            fireTargets.add(t.getTargetRef());
            return true;
        });
    }

    private void run(long millis) {
        for (long elapsed = 0; elapsed < millis; elapsed += 100) {
            time.advance(100);
            scheduler.processDue();
        }
    }

    // ========== Spacing ==========

    @Test
    @DisplayName("Speed 0.7 on a 3 second base swings every 2100ms")
    void testInterval_FiresAtFixedSpacing() {
        AttackProfile dagger = new AttackProfile("dagger", 1, 3, 0.7, DamageType.PIERCING, 0, false);
        long interval = dagger.intervalMillis(3.0);
        assertEquals(2100, interval);

        long start = clock.nowMillis();
        assertEquals(StartResult.STARTED, tickers.start("p:ada", "e:1", interval));
        run(7000);

        assertEquals(3, fireTimes.size());
        assertEquals(start + 2100, fireTimes.get(0));
        for (int i = 1; i < fireTimes.size(); i++) {
            assertEquals(2100, fireTimes.get(i) - fireTimes.get(i - 1));
        }
    }

    // ========== Start, switch, cancel ==========

    @Test
    @DisplayName("Attacking the current target again changes nothing")
    void testStart_SameTargetIsIdempotent() {
        tickers.start("p:ada", "e:1", 2000);
        long due = tickers.get("p:ada").getNextFireAt();
        run(500);
        assertEquals(StartResult.UNCHANGED, tickers.start("p:ada", "e:1", 2000));
        assertEquals(due, tickers.get("p:ada").getNextFireAt());
        run(1600);
        assertEquals(1, fireTimes.size());
    }

    @Test
    @DisplayName("Switching target keeps the ticker's phase")
    void testStart_SwitchKeepsPhase() {
        tickers.start("p:ada", "e:1", 2000);
        long due = tickers.get("p:ada").getNextFireAt();
        run(1200);
        assertEquals(StartResult.SWITCHED, tickers.start("p:ada", "e:2", 2000));
        AttackTicker t = tickers.get("p:ada");
        assertEquals(due, t.getNextFireAt());
        assertEquals("e:2", t.getTargetRef());
        run(1000);
        assertEquals(List.of(due), fireTimes);
        assertEquals(List.of("e:2"), fireTargets);
    }

    @Test
    void testCancel_StopsFiring() {
        tickers.start("p:ada", "e:1", 1000);
        run(1000);
        assertEquals(1, fireTimes.size());
        assertTrue(tickers.cancel("p:ada", "test"));
        assertFalse(tickers.isTicking("p:ada"));
        run(5000);
        assertEquals(1, fireTimes.size());
        assertFalse(tickers.cancel("p:ada", "again"));
    }

    @Test
    void testCancelTargeting() {
        tickers.start("p:ada", "e:1", 1000);
        tickers.start("p:bo", "e:1", 1000);
        tickers.start("p:cy", "e:2", 1000);
        assertEquals(2, tickers.cancelTargeting("e:1", "target died"));
        assertTrue(tickers.isTicking("p:cy"));
        assertFalse(tickers.isTicking("p:ada"));
    }

    @Test
    void testHandlerRefusal_CancelsTicker() {
        tickers.setFireHandler(t -> false);
        tickers.start("p:ada", "e:1", 1000);
        run(1000);
        assertFalse(tickers.isTicking("p:ada"));
    }

    @Test
    void testDelay_PushesNextFire() {
        tickers.start("p:ada", "e:1", 1000);
        long due = tickers.get("p:ada").getNextFireAt();
        assertTrue(tickers.delay("p:ada", 1500));
        run(2000);
        assertTrue(fireTimes.isEmpty());
        run(600);
        assertEquals(List.of(due + 1500), fireTimes);
    }

    @Test
    void testRestartAfterCancel_StartsFreshPhase() {
        tickers.start("p:ada", "e:1", 1000);
        run(300);
        tickers.cancel("p:ada", "test");
        long restartAt = clock.nowMillis();
        assertEquals(StartResult.STARTED, tickers.start("p:ada", "e:1", 1000));
        assertEquals(restartAt + 1000, tickers.get("p:ada").getNextFireAt());
    }

    @Test
    void testDelay_AfterFireMovesTheNextPhase() {
        tickers.start("p:ada", "e:1", 1000);
        run(1000);
        assertEquals(1, fireTimes.size());
        long due = tickers.get("p:ada").getNextFireAt();
        assertTrue(tickers.delay("p:ada", 500));
        run(1000);
        assertEquals(1, fireTimes.size(), "the old phase point must not fire");
        run(500);
        assertEquals(List.of(due - 1000, due + 500), fireTimes);
    }

    @Test
    @DisplayName("A ticker cancelled from inside its own fire is never scheduled again")
    void testCancelDuringFire_NotRescheduled() {
        tickers.setFireHandler(t -> {
            fireTimes.add(t.getNextFireAt());
            tickers.cancel(t.getOwnerRef(), "target died");
            return true;
        });
        tickers.start("p:ada", "e:1", 1000);
        AttackTicker t = tickers.get("p:ada");
        run(5000);
        assertEquals(1, fireTimes.size());
        assertTrue(t.isCancelled());
        assertEquals(0, t.getFireCount());
        assertFalse(tickers.isTicking("p:ada"));
    }

    @Test
    @DisplayName("Delays from another thread are never lost to a concurrent fire")
    void testDelay_ConcurrentWithFiring() throws InterruptedException {
        int delays = 400;
        tickers.start("p:ada", "e:1", 1000);
        AttackTicker t = tickers.get("p:ada");
        long firstDue = t.getNextFireAt();

        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        Thread delayer = new Thread(() -> {
            try {
                go.await();
                for (int i = 0; i < delays; i++) {
                    tickers.delay("p:ada", 1);
                    Thread.yield();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        }, "delayer");
        delayer.start();
        go.countDown();
        while (done.getCount() > 0) {
            time.advance(50);
            scheduler.processDue();
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        delayer.join();

        assertEquals(firstDue + t.getFireCount() * 1000L + delays, t.getNextFireAt());
        int fired = fireTimes.size();
        long due = t.getNextFireAt();
        run(due - clock.nowMillis() + 100);
        assertEquals(fired + 1, fireTimes.size());
        assertEquals(due, fireTimes.get(fired));
    }
}
