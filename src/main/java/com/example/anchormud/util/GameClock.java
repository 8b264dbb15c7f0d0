package com.example.anchormud.util;

import com.example.anchormud.model.DayPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Authoritative in-game clock.
 *
 * A single world counter (milliseconds) advances at a fixed ratio to real
 * elapsed time. Day number, hour, minute, day part and the time string are
 * all derived from the counter and never stored.
 */
public class GameClock {
    private static final Logger logger = LoggerFactory.getLogger(GameClock.class);

    public static final long MILLIS_PER_MINUTE = 60_000L;
    public static final long MILLIS_PER_HOUR = 60 * MILLIS_PER_MINUTE;
    public static final long MILLIS_PER_DAY = 24 * MILLIS_PER_HOUR;

    private final TimeSource timeSource;
    private final int ratio;
    private volatile long realAnchor;
    private volatile long worldAnchor;
    // last value handed out, so readers never see the clock step backwards
    private final AtomicLong lastRead = new AtomicLong(Long.MIN_VALUE);

    public GameClock(TimeSource timeSource, int ratio, long startWorldSeconds) {
        if (ratio <= 0) throw new IllegalArgumentException("time ratio must be positive: " + ratio);
        this.timeSource = timeSource;
        this.ratio = ratio;
        this.realAnchor = timeSource.currentMillis();
        this.worldAnchor = Math.max(0, startWorldSeconds) * 1000L;
        logger.info("[GameClock] Started at world second {} (ratio {}:1)", startWorldSeconds, ratio);
    }

    public int getRatio() {
        return ratio;
    }

    /**
     * Current world time in milliseconds.
     */
    public long nowMillis() {
        long computed = worldAnchor + (timeSource.currentMillis() - realAnchor) * ratio;
        return lastRead.accumulateAndGet(computed, Math::max);
    }

    public long worldSeconds() {
        return nowMillis() / 1000L;
    }

    /**
     * Re-anchor the clock at a restored world second. Only moves forward.
     */
    public synchronized void restore(long worldSeconds) {
        long target = worldSeconds * 1000L;
        if (target <= nowMillis()) {
            logger.debug("[GameClock] Ignoring restore to {} (behind current time)", worldSeconds);
            return;
        }
        this.realAnchor = timeSource.currentMillis();
        this.worldAnchor = target;
        logger.info("[GameClock] Restored to world second {}", worldSeconds);
    }

    // ========== Calendar fields ==========

    public long dayNumber() { return dayNumber(nowMillis()); }
    public int hour() { return hour(nowMillis()); }
    public int minute() { return minute(nowMillis()); }
    public int minuteOfDay() { return minuteOfDay(nowMillis()); }
    public DayPart dayPart() { return dayPart(nowMillis()); }
    public String timeString() { return timeString(nowMillis(), false); }

    public static long dayNumber(long worldMillis) {
        return worldMillis / MILLIS_PER_DAY;
    }

    public static int hour(long worldMillis) {
        return (int) ((worldMillis % MILLIS_PER_DAY) / MILLIS_PER_HOUR);
    }

    public static int minute(long worldMillis) {
        return (int) ((worldMillis % MILLIS_PER_HOUR) / MILLIS_PER_MINUTE);
    }

    public static int minuteOfDay(long worldMillis) {
        return (int) ((worldMillis % MILLIS_PER_DAY) / MILLIS_PER_MINUTE);
    }

    public static DayPart dayPart(long worldMillis) {
        return DayPart.forHour(hour(worldMillis));
    }

    /**
     * Friendly time, e.g. "It is Morning, 2 bells past dawn. (Day 3)".
     */
    public static String timeString(long worldMillis, boolean includeExact) {
        int hour = hour(worldMillis);
        DayPart part = DayPart.forHour(hour);
        String desc;
        switch (part) {
            case DAWN:
                desc = bells(hour - 5, "sunrise", "past sunrise");
                break;
            case MORNING:
                desc = bells(hour - 8, "early morning", "past dawn");
                break;
            case AFTERNOON:
                desc = bells(hour - 12, "midday", "past noon");
                break;
            case DUSK:
                desc = bells(hour - 17, "sunset", "past sunset");
                break;
            default:
                desc = bells(hour >= 20 ? hour - 20 : hour + 4, "deep night", "into the night");
                break;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("It is ").append(part.getDisplayName()).append(", ").append(desc).append('.');
        sb.append(" (Day ").append(dayNumber(worldMillis)).append(')');
        if (includeExact) {
            sb.append(" (%02d:%02d)".formatted(hour, minute(worldMillis)));
        }
        return sb.toString();
    }

    private static String bells(int count, String zero, String suffix) {
        if (count == 0) return zero;
        return count + (count > 1 ? " bells " : " bell ") + suffix;
    }
}
