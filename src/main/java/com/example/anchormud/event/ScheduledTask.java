package com.example.anchormud.event;

/**
 * Cancellation token for an event queued in the {@link EventScheduler}.
 * A cancelled task is skipped when it comes due and never rescheduled.
 */
public final class ScheduledTask implements Comparable<ScheduledTask> {

    private final String name;
    private final GameEvent event;
    private final long sequence;
    private final long periodMillis;      // 0 for one-shot
    private long executeAt;               // world millis; changes only while out of the queue
    private volatile boolean cancelled;

    ScheduledTask(String name, GameEvent event, long executeAt, long periodMillis, long sequence) {
        this.name = name;
        this.event = event;
        this.executeAt = executeAt;
        this.periodMillis = periodMillis;
        this.sequence = sequence;
    }

    public String getName() { return name; }
    public long getExecuteAt() { return executeAt; }
    public boolean isRecurring() { return periodMillis > 0; }

    GameEvent getEvent() { return event; }
    long getPeriodMillis() { return periodMillis; }

    void advance() {
        executeAt += periodMillis;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public int compareTo(ScheduledTask other) {
        int c = Long.compare(this.executeAt, other.executeAt);
        return c != 0 ? c : Long.compare(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "ScheduledTask[" + name + " @" + executeAt + (cancelled ? " cancelled" : "") + "]";
    }
}
