package com.example.anchormud;

import com.example.anchormud.model.StoreHours;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.StoreHoursService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for clock-gated store opening hours.
 */
public class StoreHoursServiceTest {

    private static final long DAY_SECONDS = 24 * 3600L;

    private static StoreHoursService serviceAt(long day, int hour, int minute) {
        GameClock clock = new GameClock(new ManualTimeSource(), 1, day * DAY_SECONDS + hour * 3600L + minute * 60L);
        StoreHoursService service = new StoreHoursService(clock);
        service.register(StoreHours.parse("tavern", "10:00", "02:00", Set.of()));
        service.register(StoreHours.parse("sheds", "07:00", "18:00", Set.of(3L)));
        return service;
    }

    // ========== Hours ==========

    @Test
    void testParse_Times() {
        StoreHours hours = StoreHours.parse("sheds", "07:30", "18:00", Set.of(3L));
        assertEquals(450, hours.openMinute());
        assertEquals("07:30", hours.openTime());
        assertEquals("18:00", hours.closeTime());
        assertTrue(hours.closedDays().contains(3L));
    }

    @Test
    void testParse_Rejects() {
        assertThrows(IllegalArgumentException.class, () -> StoreHours.parse("sheds", "25:00", "18:00", Set.of()));
        assertThrows(IllegalArgumentException.class, () -> StoreHours.parse(" ", "07:00", "18:00", Set.of()));
    }

    @Test
    void testIsOpenAt_DaytimeRange() {
        StoreHours hours = StoreHours.parse("sheds", "07:00", "18:00", Set.of());
        assertFalse(hours.isOpenAt(0, 6 * 60 + 59));
        assertTrue(hours.isOpenAt(0, 7 * 60));
        assertTrue(hours.isOpenAt(0, 17 * 60 + 59));
        assertFalse(hours.isOpenAt(0, 18 * 60));
    }

    @Test
    @DisplayName("Hours that close before they open run past midnight")
    void testIsOpenAt_WrapsPastMidnight() {
        StoreHours hours = StoreHours.parse("tavern", "10:00", "02:00", Set.of());
        assertTrue(hours.isOpenAt(0, 23 * 60));
        assertTrue(hours.isOpenAt(0, 60));
        assertFalse(hours.isOpenAt(0, 2 * 60));
        assertFalse(hours.isOpenAt(0, 9 * 60 + 59));
        assertTrue(hours.isOpenAt(0, 10 * 60));
    }

    @Test
    void testIsOpenAt_EqualTimesMeanAlwaysOpen() {
        StoreHours hours = StoreHours.parse("stall", "00:00", "00:00", Set.of());
        assertTrue(hours.isOpenAt(0, 0));
        assertTrue(hours.isOpenAt(0, 12 * 60));
    }

    // ========== Service ==========

    @Test
    void testService_OpenAndClosed() {
        assertTrue(serviceAt(0, 12, 0).isOpen("tavern"));
        assertTrue(serviceAt(0, 12, 0).isOpen("sheds"));
        assertFalse(serviceAt(0, 5, 0).isOpen("tavern"));
        assertFalse(serviceAt(0, 19, 0).isOpen("sheds"));
    }

    @Test
    void testService_ClosedDay() {
        StoreHoursService service = serviceAt(3, 12, 0);
        assertFalse(service.isOpen("sheds"));
        assertTrue(service.isOpen("tavern"));
        assertTrue(serviceAt(4, 12, 0).isOpen("sheds"));
    }

    @Test
    void testService_Status() {
        assertEquals("Open", serviceAt(0, 12, 0).status("tavern"));
        assertEquals("Closed (opens at 10:00)", serviceAt(0, 5, 0).status("tavern"));
        assertEquals("Closed today", serviceAt(3, 12, 0).status("sheds"));
    }

    @Test
    void testService_UnregisteredStoreIsAlwaysOpen() {
        StoreHoursService service = serviceAt(0, 4, 0);
        assertFalse(service.hasHours("market"));
        assertNull(service.getHours("market"));
        assertTrue(service.isOpen("market"));
        assertEquals("Open", service.status("market"));
    }
}
