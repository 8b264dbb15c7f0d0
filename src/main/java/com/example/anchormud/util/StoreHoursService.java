package com.example.anchormud.util;

import com.example.anchormud.model.StoreHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers whether a store is open at the current world time.
 * A store with no registered hours is always open.
 */
public class StoreHoursService {
    private static final Logger logger = LoggerFactory.getLogger(StoreHoursService.class);

    private final GameClock clock;
    private final Map<String, StoreHours> hours = new ConcurrentHashMap<>();

    public StoreHoursService(GameClock clock) {
        this.clock = clock;
    }

    public void register(StoreHours storeHours) {
        hours.put(storeHours.storeId(), storeHours);
        logger.debug("[StoreHoursService] {} open {}-{}, closed on days {}", storeHours.storeId(),
                storeHours.openTime(), storeHours.closeTime(), storeHours.closedDays());
    }

    public StoreHours getHours(String storeId) {
        return storeId == null ? null : hours.get(storeId);
    }

    public boolean hasHours(String storeId) {
        return getHours(storeId) != null;
    }

    public boolean isOpen(String storeId) {
        StoreHours h = getHours(storeId);
        return h == null || h.isOpenAt(clock.dayNumber(), clock.minuteOfDay());
    }

    /**
     * "Open", "Closed today" or "Closed (opens at HH:MM)".
     */
    public String status(String storeId) {
        if (isOpen(storeId)) {
            return "Open";
        }
        StoreHours h = getHours(storeId);
        if (h.closedDays().contains(clock.dayNumber())) {
            return "Closed today";
        }
        return "Closed (opens at " + h.openTime() + ")";
    }
}
