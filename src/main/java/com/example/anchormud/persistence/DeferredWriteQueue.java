package com.example.anchormud.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Out-of-band executor for non-critical writes to external collaborators.
 *
 * Submitting never blocks the caller. A failed write is retried with linear
 * backoff up to the configured number of attempts and then dropped with an
 * ERROR log. Combat resolution never waits on this queue.
 */
public class DeferredWriteQueue {
    private static final Logger logger = LoggerFactory.getLogger(DeferredWriteQueue.class);

    @FunctionalInterface
    public interface Write {
        void run() throws PersistenceException;
    }

    private final ScheduledExecutorService executor;
    private final int maxAttempts;
    private final long backoffMillis;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicInteger dropped = new AtomicInteger();

    public DeferredWriteQueue(int maxAttempts, long backoffMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0, backoffMillis);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anchormud-writes");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue a write. The description is used in log lines.
     */
    public void submit(String description, Write write) {
        pending.incrementAndGet();
        try {
            executor.execute(() -> attempt(description, write, 1));
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            dropped.incrementAndGet();
            logger.error("[DeferredWriteQueue] Queue closed, dropping '{}'", description);
        }
    }

    private void attempt(String description, Write write, int attempt) {
        try {
            write.run();
            pending.decrementAndGet();
            if (attempt > 1) {
                logger.info("[DeferredWriteQueue] '{}' succeeded on attempt {}", description, attempt);
            }
        } catch (PersistenceException | RuntimeException e) {
            if (attempt >= maxAttempts) {
                pending.decrementAndGet();
                dropped.incrementAndGet();
                logger.error("[DeferredWriteQueue] Dropping '{}' after {} attempts", description, attempt, e);
                return;
            }
            long delay = backoffMillis * attempt;
            logger.warn("[DeferredWriteQueue] '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                    description, attempt, maxAttempts, delay, e.getMessage());
            try {
                executor.schedule(() -> attempt(description, write, attempt + 1), delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                pending.decrementAndGet();
                dropped.incrementAndGet();
                logger.error("[DeferredWriteQueue] Queue closed during retry, dropping '{}'", description);
            }
        }
    }

    public int getPendingCount() {
        return pending.get();
    }

    public int getDroppedCount() {
        return dropped.get();
    }

    /**
     * Wait until all queued writes have settled or the timeout passes.
     * @return true if nothing is pending
     */
    public boolean awaitIdle(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (pending.get() > 0) {
            if (System.currentTimeMillis() >= deadline) return false;
            Thread.sleep(10);
        }
        return true;
    }

    public void shutdown(long timeoutMillis) {
        try {
            awaitIdle(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor.shutdownNow();
        if (pending.get() > 0) {
            logger.warn("[DeferredWriteQueue] Shutdown with {} writes pending", pending.get());
        }
    }
}
