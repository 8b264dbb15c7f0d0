package com.example.anchormud;

import com.example.anchormud.model.CreatureTemplate;
import com.example.anchormud.model.Direction;
import com.example.anchormud.model.ManeuverDefinition;
import com.example.anchormud.model.NpcTemplate;
import com.example.anchormud.model.PursuitMode;
import com.example.anchormud.model.ReactionTrigger;
import com.example.anchormud.model.Room;
import com.example.anchormud.model.RoomFlag;
import com.example.anchormud.model.StoreHours;
import com.example.anchormud.model.WeatherExposure;
import com.example.anchormud.persistence.ContentException;
import com.example.anchormud.persistence.WorldContent;
import com.example.anchormud.persistence.YamlContentLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading world content from YAML.
 */
public class YamlContentLoaderTest {

    private static WorldContent content;

    @BeforeAll
    static void load() {
        content = new YamlContentLoader().load();
    }

    @Test
    void testRooms_ExitsAndFlags() {
        Room common = content.requireRoom("black_anchor_common");
        assertTrue(common.hasFlag(RoomFlag.SAFE));
        assertEquals(WeatherExposure.INDOOR, common.getExposure());
        assertEquals("harbor_docks", common.getExit(Direction.NORTH));
        assertEquals("black_anchor_cellar", common.getExit(Direction.DOWN));
        assertNull(common.getExit(Direction.WEST));

        Room stairs = content.requireRoom("bilge_stairs");
        assertTrue(stairs.hasFlag(RoomFlag.NO_PURSUIT));
        assertEquals("docks", stairs.getZoneId());
    }

    @Test
    void testRooms_SpawnAndLootRules() {
        Room docks = content.requireRoom("harbor_docks");
        assertEquals(1, docks.getSpawnRules().size());
        assertEquals("harbor_gull", docks.getSpawnRules().get(0).templateId());
        assertEquals(1, docks.getLootRules().size());
        assertEquals(600, docks.getLootRules().get(0).expirySeconds());
    }

    @Test
    void testCreatures_AttackArmorAndBehavior() {
        CreatureTemplate rat = (CreatureTemplate) content.getCombatTemplate("dock_rat");
        assertEquals(6, rat.getMaxHp());
        assertEquals(0.8, rat.getAttack().speed(), 0.0001);
        assertEquals(PursuitMode.SHORT, rat.getBehavior().pursuit());
        assertEquals("rat_loot", rat.getLootTableId());

        CreatureTemplate crab = (CreatureTemplate) content.getCombatTemplate("bilge_crab");
        assertTrue(crab.getBehavior().aggressive());
        assertEquals(1, crab.getArmor().size());
        assertEquals(2, crab.getArmor().get(0).getReduction());
    }

    @Test
    void testManeuvers() {
        ManeuverDefinition riposte = content.getManeuver("riposte");
        assertTrue(riposte.isReaction());
        assertEquals(ReactionTrigger.ON_ATTACKED, riposte.reaction());
        assertTrue(content.getManeuver("throw-knife").ranged());
        assertFalse(content.getManeuver("feint").isReaction());
        assertNull(content.getManeuver("backflip"));
    }

    @Test
    void testNpcs_Schedules() {
        NpcTemplate marta = (NpcTemplate) content.getTemplate("marta");
        assertEquals("black_anchor_common", marta.getHomeRoomId());
        assertEquals(2, marta.getSchedule().size());
        assertTrue(marta.getSchedule().get(1).wraps());
    }

    @Test
    void testEncounterTable() {
        assertNotNull(content.getEncounterTable("docks"));
        assertNull(content.getEncounterTable("anchor"));
    }

    @Test
    void testStoreHours() {
        StoreHours tavern = content.getStoreHours().stream()
                .filter(h -> h.storeId().equals("black_anchor_common")).findFirst().orElseThrow();
        assertEquals("10:00", tavern.openTime());
        assertEquals("02:00", tavern.closeTime());
        assertTrue(tavern.closedDays().isEmpty());

        StoreHours sheds = content.getStoreHours().stream()
                .filter(h -> h.storeId().equals("net_sheds")).findFirst().orElseThrow();
        assertTrue(sheds.closedDays().contains(3L));
    }

    // ========== Validation ==========

    @Test
    void testMissingResource() {
        assertThrows(ContentException.class, () -> new YamlContentLoader().load("/data/missing.yaml"));
    }

    @Test
    @DisplayName("An exit to an unknown room is rejected")
    void testBrokenExit() {
        ContentException e = assertThrows(ContentException.class,
                () -> new YamlContentLoader().load("/data/bad-exit.yaml"));
        assertTrue(e.getMessage().contains("nowhere"));
    }

    @Test
    void testOverlappingSchedule() {
        assertThrows(ContentException.class, () -> new YamlContentLoader().load("/data/overlapping-schedule.yaml"));
    }

    @Test
    void testUnknownLootTable() {
        ContentException e = assertThrows(ContentException.class,
                () -> new YamlContentLoader().load("/data/unknown-loot-table.yaml"));
        assertTrue(e.getMessage().contains("eel_loot"));
    }

    @Test
    void testUnknownStore() {
        ContentException e = assertThrows(ContentException.class,
                () -> new YamlContentLoader().load("/data/unknown-store.yaml"));
        assertTrue(e.getMessage().contains("chandlery"));
    }
}
