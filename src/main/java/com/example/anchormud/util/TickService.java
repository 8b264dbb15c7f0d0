package com.example.anchormud.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Simple scheduler for periodic "tick" tasks.
 * Subsystems register named Runnables at different intervals (real ms).
 * Every task is wrapped so an exception is logged and the task keeps running.
 */
public class TickService {
    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService() {
        // single-threaded scheduler; room locks make this safe to widen later
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anchormud-tick");
            t.setDaemon(true);
            return t;
        });
    }

    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("[TickService] Task '{}' failed", name, e);
            }
        };
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) {
            previous.cancel(false);
        }
        return f;
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(false);
    }

    public boolean isScheduled(String name) {
        return tasks.containsKey(name);
    }

    public void shutdown() {
        for (Map.Entry<String, ScheduledFuture<?>> e : tasks.entrySet()) {
            e.getValue().cancel(false);
        }
        tasks.clear();
        scheduler.shutdownNow();
        logger.info("[TickService] Shutdown");
    }
}
