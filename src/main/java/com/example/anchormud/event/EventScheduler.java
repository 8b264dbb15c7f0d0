package com.example.anchormud.event;

import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event scheduler keyed on world time.
 *
 * Events sit in a priority queue ordered by due time (ties in submission
 * order) and are drained in batches on each pulse. Every schedule call
 * returns a {@link ScheduledTask} so owners can cancel deterministically
 * instead of relying on background loops.
 */
public class EventScheduler {
    private static final Logger logger = LoggerFactory.getLogger(EventScheduler.class);

    /** Maximum events to process per pulse to prevent overload */
    public static final int MAX_EVENTS_PER_TICK = 200;

    private final GameClock clock;
    private final PriorityBlockingQueue<ScheduledTask> queue = new PriorityBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean running = true;

    public EventScheduler(GameClock clock) {
        this.clock = clock;
    }

    /**
     * Drive the scheduler from the tick service.
     */
    public void initialize(TickService tickService, long pulseMillis) {
        tickService.scheduleAtFixedRate("event-scheduler", this::processDue, pulseMillis, pulseMillis);
        logger.info("[EventScheduler] Initialized ({}ms pulse)", pulseMillis);
    }

    /**
     * Schedule a one-time event at an absolute world time.
     */
    public ScheduledTask scheduleAt(String name, GameEvent event, long worldMillis) {
        ScheduledTask task = new ScheduledTask(name, event, worldMillis, 0, sequence.incrementAndGet());
        queue.offer(task);
        return task;
    }

    /**
     * Schedule a one-time event after a delay in world milliseconds.
     */
    public ScheduledTask scheduleAfter(String name, GameEvent event, long delayMillis) {
        return scheduleAt(name, event, clock.nowMillis() + Math.max(0, delayMillis));
    }

    /**
     * Schedule a recurring event. The period is kept in phase: each run is
     * due exactly one period after the previous due time.
     */
    public ScheduledTask scheduleRecurring(String name, GameEvent event, long initialDelayMillis, long periodMillis) {
        if (periodMillis <= 0) throw new IllegalArgumentException("period must be positive");
        ScheduledTask task = new ScheduledTask(name, event, clock.nowMillis() + initialDelayMillis,
                periodMillis, sequence.incrementAndGet());
        queue.offer(task);
        return task;
    }

    /**
     * Run every event due at the current world time, up to the per-pulse cap.
     * @return number of events executed
     */
    public int processDue() {
        if (!running) return 0;
        long now = clock.nowMillis();
        int processed = 0;
        while (processed < MAX_EVENTS_PER_TICK) {
            ScheduledTask head = queue.peek();
            if (head == null || head.getExecuteAt() > now) {
                break;
            }
            ScheduledTask task = queue.poll();
            if (task == null) break;
            if (task.getExecuteAt() > now) {
                // a racing offer put an earlier task ahead of us
                queue.offer(task);
                continue;
            }
            if (task.isCancelled()) {
                continue;
            }
            try {
                task.getEvent().execute();
            } catch (RuntimeException e) {
                logger.error("[EventScheduler] Error executing {}", task.getName(), e);
            }
            processed++;
            if (task.isRecurring() && !task.isCancelled()) {
                task.advance();
                queue.offer(task);
            }
        }
        if (processed == MAX_EVENTS_PER_TICK) {
            logger.warn("[EventScheduler] Event cap reached; {} events still queued", queue.size());
        }
        return processed;
    }

    public void shutdown() {
        running = false;
        queue.clear();
        logger.info("[EventScheduler] Shutdown");
    }

    /**
     * Get the number of queued events, cancelled ones included until they are drained.
     */
    public int getPendingEventCount() {
        return queue.size();
    }
}
