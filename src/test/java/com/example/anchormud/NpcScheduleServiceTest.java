package com.example.anchormud;

import com.example.anchormud.model.NpcTemplate;
import com.example.anchormud.model.ScheduleBlock;
import com.example.anchormud.persistence.ContentException;
import com.example.anchormud.persistence.WorldContent;
import com.example.anchormud.persistence.YamlContentLoader;
import com.example.anchormud.util.GameClock;
import com.example.anchormud.util.NpcScheduleService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NPC daily schedules.
 */
public class NpcScheduleServiceTest {

    private static WorldContent content;

    @BeforeAll
    static void loadContent() {
        content = new YamlContentLoader().load();
    }

    private static NpcTemplate npc(String id) {
        return (NpcTemplate) content.getTemplate(id);
    }

    private static NpcScheduleService serviceAt(int hour, int minute) {
        GameClock clock = new GameClock(new ManualTimeSource(), 1, hour * 3600L + minute * 60L);
        NpcScheduleService service = new NpcScheduleService(clock);
        service.register(npc("marta"));
        service.register(npc("old_tobin"));
        return service;
    }

    // ========== Blocks ==========

    @Test
    void testBlock_ParseAndContains() {
        ScheduleBlock day = ScheduleBlock.parse("06:00", "23:00", "black_anchor_common");
        assertEquals(360, day.startMinute());
        assertTrue(day.contains(360));
        assertTrue(day.contains(1379));
        assertFalse(day.contains(1380));
        assertFalse(day.wraps());
    }

    @Test
    void testBlock_WrapsPastMidnight() {
        ScheduleBlock night = ScheduleBlock.parse("23:00", "02:00", "black_anchor_cellar");
        assertTrue(night.wraps());
        assertTrue(night.contains(23 * 60 + 30));
        assertTrue(night.contains(0));
        assertTrue(night.contains(119));
        assertFalse(night.contains(120));
    }

    @Test
    void testBlock_RejectsBadTime() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleBlock.parse("25:00", "02:00", "x"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleBlock.parse("ab", "02:00", "x"));
    }

    @Test
    @DisplayName("Overlapping blocks are rejected at load")
    void testValidate_RejectsOverlap() {
        List<ScheduleBlock> blocks = List.of(
                ScheduleBlock.parse("06:00", "12:00", "net_sheds"),
                ScheduleBlock.parse("11:00", "18:00", "harbor_docks"));
        assertThrows(ContentException.class, () -> WorldContent.validateSchedule("tobin", blocks));
    }

    @Test
    void testValidate_AdjacentBlocksAllowed() {
        List<ScheduleBlock> blocks = List.of(
                ScheduleBlock.parse("06:00", "23:00", "black_anchor_common"),
                ScheduleBlock.parse("23:00", "02:00", "black_anchor_cellar"));
        assertDoesNotThrow(() -> WorldContent.validateSchedule("marta", blocks));
    }

    // ========== Resolution ==========

    @Test
    void testScheduledRoom_ByTimeOfDay() {
        NpcScheduleService service = serviceAt(8, 0);
        assertEquals("black_anchor_common", service.scheduledRoom("marta", 8 * 60));
        assertEquals("black_anchor_cellar", service.scheduledRoom("marta", 23 * 60 + 15));
        assertEquals("black_anchor_cellar", service.scheduledRoom("marta", 60));
        assertNull(service.scheduledRoom("marta", 3 * 60), "Marta is absent between two and six");
        assertEquals("harbor_docks", service.scheduledRoom("old_tobin", 13 * 60));
    }

    @Test
    void testCandidatesFor_IndexesEveryScheduledRoom() {
        NpcScheduleService service = serviceAt(8, 0);
        assertTrue(service.candidatesFor("black_anchor_cellar").contains("marta"));
        assertTrue(service.candidatesFor("harbor_docks").contains("old_tobin"));
        assertTrue(service.candidatesFor("pier_end").isEmpty());
    }

    @Test
    void testResolve_UsesClock() {
        assertEquals("black_anchor_common", serviceAt(10, 0).resolve("marta", null, null));
        assertEquals("black_anchor_cellar", serviceAt(23, 30).resolve("marta", "black_anchor_common", null));
        assertNull(serviceAt(4, 0).resolve("marta", "black_anchor_cellar", null));
    }

    @Test
    @DisplayName("A busy NPC stays put and moves once it is free")
    void testResolve_DefersWhileBusy() {
        NpcScheduleService service = serviceAt(23, 30);
        assertEquals("black_anchor_common", service.resolve("marta", "black_anchor_common", "in combat"));
        assertTrue(service.isDeferred("marta"));
        assertEquals("black_anchor_cellar", service.resolve("marta", "black_anchor_common", null));
        assertFalse(service.isDeferred("marta"));
    }
}
