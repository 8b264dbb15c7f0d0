package com.example.anchormud.combat;

import com.example.anchormud.event.ScheduledTask;

/**
 * Per-combatant repeating basic-attack timer. All times are world millis.
 * Phase changes and task replacement happen under the ticker's monitor.
 */
public class AttackTicker {

    private final String ownerRef;
    private final long intervalMillis;
    private volatile String targetRef;
    private volatile long nextFireAt;
    private volatile long lastFiredAt = -1;
    private volatile int fireCount;
    private volatile boolean cancelled;
    private ScheduledTask task;

    AttackTicker(String ownerRef, String targetRef, long intervalMillis, long nextFireAt) {
        if (intervalMillis <= 0) throw new IllegalArgumentException("interval must be positive");
        this.ownerRef = ownerRef;
        this.targetRef = targetRef;
        this.intervalMillis = intervalMillis;
        this.nextFireAt = nextFireAt;
    }

    public String getOwnerRef() { return ownerRef; }
    public String getTargetRef() { return targetRef; }
    public long getIntervalMillis() { return intervalMillis; }
    public long getNextFireAt() { return nextFireAt; }
    public long getLastFiredAt() { return lastFiredAt; }
    public int getFireCount() { return fireCount; }
    public boolean isCancelled() { return cancelled; }

    void setTargetRef(String targetRef) {
        this.targetRef = targetRef;
    }

    synchronized void pushBack(long delayMillis) {
        this.nextFireAt += delayMillis;
    }

    /**
     * Record a fire at the scheduled time and move to the next phase point.
     */
    synchronized void recordFire() {
        lastFiredAt = nextFireAt;
        fireCount++;
        nextFireAt += intervalMillis;
    }

    synchronized void replaceTask(ScheduledTask next) {
        if (task != null) task.cancel();
        task = next;
    }

    synchronized void cancel() {
        cancelled = true;
        if (task != null) task.cancel();
    }

    @Override
    public String toString() {
        return "AttackTicker[" + ownerRef + " -> " + targetRef + " next=" + nextFireAt
                + (cancelled ? " cancelled" : "") + "]";
    }
}
