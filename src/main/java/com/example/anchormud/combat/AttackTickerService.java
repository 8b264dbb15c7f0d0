package com.example.anchormud.combat;

import com.example.anchormud.event.EventScheduler;
import com.example.anchormud.util.GameClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every attack ticker and drives them through the event scheduler.
 *
 * At most one ticker exists per combatant. Each fire is handed to the
 * {@link FireHandler}; the ticker is rescheduled one interval after its
 * previous due time only if the handler accepts the fire.
 */
public class AttackTickerService {
    private static final Logger logger = LoggerFactory.getLogger(AttackTickerService.class);

    /**
     * Receives ticker fires. Returning false cancels the ticker.
     */
    @FunctionalInterface
    public interface FireHandler {
        boolean onFire(AttackTicker ticker);
    }

    /** What {@link #start} did. */
    public enum StartResult {
        STARTED,
        SWITCHED,
        UNCHANGED
    }

    private final GameClock clock;
    private final EventScheduler scheduler;
    private final Map<String, AttackTicker> tickers = new ConcurrentHashMap<>();
    private volatile FireHandler fireHandler = t -> true;

    public AttackTickerService(GameClock clock, EventScheduler scheduler) {
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public void setFireHandler(FireHandler handler) {
        this.fireHandler = handler;
    }

    /**
     * Create a ticker, or retarget the existing one without changing its phase.
     * Re-issuing against the current target changes nothing.
     */
    public StartResult start(String ownerRef, String targetRef, long intervalMillis) {
        AttackTicker existing = tickers.get(ownerRef);
        if (existing != null && !existing.isCancelled()) {
            if (targetRef.equals(existing.getTargetRef())) {
                return StartResult.UNCHANGED;
            }
            existing.setTargetRef(targetRef);
            logger.debug("[AttackTickerService] {} switched target to {}", ownerRef, targetRef);
            return StartResult.SWITCHED;
        }
        AttackTicker ticker = new AttackTicker(ownerRef, targetRef, intervalMillis, clock.nowMillis() + intervalMillis);
        tickers.put(ownerRef, ticker);
        schedule(ticker);
        logger.debug("[AttackTickerService] Started {}", ticker);
        return StartResult.STARTED;
    }

    public AttackTicker get(String ownerRef) {
        AttackTicker t = ownerRef == null ? null : tickers.get(ownerRef);
        return t == null || t.isCancelled() ? null : t;
    }

    public boolean isTicking(String ownerRef) {
        return get(ownerRef) != null;
    }

    /**
     * Push the owner's next fire back, keeping the ticker alive.
     */
    public boolean delay(String ownerRef, long delayMillis) {
        AttackTicker t = get(ownerRef);
        if (t == null || delayMillis <= 0) return false;
        synchronized (t) {
            t.pushBack(delayMillis);
            schedule(t);
        }
        return true;
    }

    /**
     * Cancel the owner's ticker outright.
     * @return true if a ticker was running
     */
    public boolean cancel(String ownerRef, String reason) {
        AttackTicker t = ownerRef == null ? null : tickers.remove(ownerRef);
        if (t == null) return false;
        t.cancel();
        logger.debug("[AttackTickerService] Cancelled ticker for {} ({})", ownerRef, reason);
        return true;
    }

    /**
     * Cancel every ticker aimed at the given target.
     */
    public int cancelTargeting(String targetRef, String reason) {
        int n = 0;
        for (AttackTicker t : tickers.values()) {
            if (targetRef.equals(t.getTargetRef()) && cancel(t.getOwnerRef(), reason)) n++;
        }
        return n;
    }

    public Collection<AttackTicker> all() {
        return Collections.unmodifiableCollection(tickers.values());
    }

    public void shutdown() {
        for (String ref : tickers.keySet()) {
            cancel(ref, "shutdown");
        }
    }

    private void schedule(AttackTicker ticker) {
        synchronized (ticker) {
            if (ticker.isCancelled()) return;
            ticker.replaceTask(scheduler.scheduleAt("ticker-" + ticker.getOwnerRef(),
                    () -> fire(ticker), ticker.getNextFireAt()));
        }
    }

    private void fire(AttackTicker ticker) {
        if (ticker.isCancelled() || tickers.get(ticker.getOwnerRef()) != ticker) {
            return;
        }
        boolean keep;
        try {
            keep = fireHandler.onFire(ticker);
        } catch (RuntimeException e) {
            logger.error("[AttackTickerService] Fire handler failed for {}", ticker, e);
            keep = false;
        }
        if (!keep) {
            tickers.remove(ticker.getOwnerRef(), ticker);
            ticker.cancel();
            return;
        }
        synchronized (ticker) {
            if (ticker.isCancelled()) {
                return;
            }
            ticker.recordFire();
            schedule(ticker);
        }
    }
}
