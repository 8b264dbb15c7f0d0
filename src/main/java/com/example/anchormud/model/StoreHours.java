package com.example.anchormud.model;

import java.util.Set;

/**
 * Daily opening hours of a store, keyed by room or NPC id.
 * A close time not after the open time runs past midnight; equal times mean
 * open around the clock. Closed days are world day numbers.
 */
public record StoreHours(String storeId, int openMinute, int closeMinute, Set<Long> closedDays) {

    public StoreHours {
        if (storeId == null || storeId.isBlank()) {
            throw new IllegalArgumentException("store hours need a store id");
        }
        if (openMinute < 0 || openMinute >= ScheduleBlock.MINUTES_PER_DAY
                || closeMinute < 0 || closeMinute >= ScheduleBlock.MINUTES_PER_DAY) {
            throw new IllegalArgumentException("store minutes out of range: " + openMinute + "-" + closeMinute);
        }
        closedDays = closedDays == null ? Set.of() : Set.copyOf(closedDays);
    }

    public static StoreHours parse(String storeId, String open, String close, Set<Long> closedDays) {
        return new StoreHours(storeId, ScheduleBlock.parseMinute(open), ScheduleBlock.parseMinute(close), closedDays);
    }

    public boolean isOpenAt(long dayNumber, int minuteOfDay) {
        return !closedDays.contains(dayNumber) && ScheduleBlock.covers(openMinute, closeMinute, minuteOfDay);
    }

    public String openTime() {
        return ScheduleBlock.formatMinute(openMinute);
    }

    public String closeTime() {
        return ScheduleBlock.formatMinute(closeMinute);
    }
}
