package com.example.anchormud;

import com.example.anchormud.combat.LeaveMode;
import com.example.anchormud.util.GameConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GameConfigTest {

    @Test
    void testDefaults_WhenEmpty() {
        GameConfig config = GameConfig.of(Map.of());
        assertEquals(3, config.timeRatio());
        assertEquals(28_800L, config.startSeconds());
        assertEquals(3000L, config.roundMillis());
        assertEquals(9000L, config.fleeWindowMillis());
        assertEquals(60_000L, config.disconnectGraceMillis());
        assertEquals("black_anchor_common", config.respawnRoom());
        assertEquals(LeaveMode.DISENGAGE_AND_PURSUIT,
                config.getEnum(GameConfig.LEAVE_MODE, LeaveMode.class, LeaveMode.DISENGAGE_AND_PURSUIT));
    }

    @Test
    void testLoad_DefaultResource() {
        GameConfig config = GameConfig.load();
        assertEquals(3.0, config.baseAttackIntervalSeconds(), 0.0001);
        assertEquals(1, config.maxReactionsPerRound());
        assertEquals(0.35, config.encounterRollChance(), 0.0001);
        assertTrue(config.getString(GameConfig.PERSISTENCE_URL, "").startsWith("jdbc:h2:mem:"));
    }

    @Test
    void testLoad_MissingResourceFallsBack() {
        GameConfig config = GameConfig.load("/config/nope.yaml");
        assertEquals(50, config.disengageDifficulty());
    }

    @Test
    void testWith_OverridesOneKey() {
        GameConfig base = GameConfig.of(Map.of(GameConfig.ROUND_SECONDS, 2.5));
        GameConfig changed = base.with(GameConfig.DISENGAGE_DIFFICULTY, 70);
        assertEquals(2500L, changed.roundMillis());
        assertEquals(70, changed.disengageDifficulty());
        assertEquals(50, base.disengageDifficulty());
    }

    @Test
    void testBadValues_FallBackToDefault() {
        GameConfig config = GameConfig.of(Map.of(
                GameConfig.TIME_RATIO, "fast",
                GameConfig.LEAVE_MODE, "teleport"));
        assertEquals(3, config.timeRatio());
        assertEquals(LeaveMode.LEAVE_ENDS_COMBAT,
                config.getEnum(GameConfig.LEAVE_MODE, LeaveMode.class, LeaveMode.LEAVE_ENDS_COMBAT));
    }

    @Test
    void testEnum_CaseInsensitive() {
        GameConfig config = GameConfig.of(Map.of(GameConfig.LEAVE_MODE, "leave_ends_combat"));
        assertEquals(LeaveMode.LEAVE_ENDS_COMBAT,
                config.getEnum(GameConfig.LEAVE_MODE, LeaveMode.class, LeaveMode.DISENGAGE_AND_PURSUIT));
    }

    @Test
    void testBoolean() {
        GameConfig config = GameConfig.of(Map.of("a", "yes", "b", "TRUE", "c", "nah"));
        assertTrue(config.getBoolean("a", false));
        assertTrue(config.getBoolean("b", false));
        assertFalse(config.getBoolean("c", true));
        assertTrue(config.getBoolean("missing", true));
    }
}
