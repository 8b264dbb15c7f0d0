package com.example.anchormud.model;

/**
 * One time-range to room binding in an NPC's daily schedule.
 * Minutes are minute-of-day (0..1439). A block whose end is not after its
 * start wraps past midnight.
 */
public record ScheduleBlock(int startMinute, int endMinute, String roomId) {

    public static final int MINUTES_PER_DAY = 24 * 60;

    public ScheduleBlock {
        if (startMinute < 0 || startMinute >= MINUTES_PER_DAY
                || endMinute < 0 || endMinute >= MINUTES_PER_DAY) {
            throw new IllegalArgumentException("schedule minutes out of range: " + startMinute + "-" + endMinute);
        }
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("schedule block needs a room");
        }
    }

    /**
     * Parse a block from "HH:MM" start/end strings.
     */
    public static ScheduleBlock parse(String start, String end, String roomId) {
        return new ScheduleBlock(parseMinute(start), parseMinute(end), roomId);
    }

    public static int parseMinute(String hhmm) {
        if (hhmm == null) throw new IllegalArgumentException("time is required");
        String[] parts = hhmm.trim().split(":");
        try {
            int h = Integer.parseInt(parts[0]);
            int m = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            if (h < 0 || h > 23 || m < 0 || m > 59) {
                throw new IllegalArgumentException("bad time: " + hhmm);
            }
            return h * 60 + m;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad time: " + hhmm, e);
        }
    }

    public static String formatMinute(int minuteOfDay) {
        return String.format("%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }

    /**
     * Whether a daily range covers the given minute. Start inclusive, end
     * exclusive; an end not after the start wraps past midnight.
     */
    public static boolean covers(int startMinute, int endMinute, int minuteOfDay) {
        if (endMinute <= startMinute) {
            return minuteOfDay >= startMinute || minuteOfDay < endMinute;
        }
        return minuteOfDay >= startMinute && minuteOfDay < endMinute;
    }

    public boolean wraps() {
        return endMinute <= startMinute;
    }

    /**
     * Whether the block covers the given minute of day.
     */
    public boolean contains(int minuteOfDay) {
        return covers(startMinute, endMinute, minuteOfDay);
    }

    /**
     * Whether two blocks share at least one minute.
     */
    public boolean overlaps(ScheduleBlock other) {
        // two arcs on the day circle intersect iff one contains the start of the other
        return contains(other.startMinute) || other.contains(startMinute);
    }
}
