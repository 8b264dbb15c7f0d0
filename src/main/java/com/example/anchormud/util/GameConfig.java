package com.example.anchormud.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Runtime configuration.
 *
 * Values come from {@code /config/anchormud.yaml} on the classpath, flattened
 * into dotted keys ("combat.round-seconds"). A JVM property
 * {@code anchormud.<key>} or an environment variable {@code ANCHORMUD_<KEY>}
 * (dots and dashes as underscores) overrides the file value.
 */
public class GameConfig {
    private static final Logger logger = LoggerFactory.getLogger(GameConfig.class);

    public static final String DEFAULT_RESOURCE = "/config/anchormud.yaml";
    private static final String PROPERTY_PREFIX = "anchormud.";
    private static final String ENV_PREFIX = "ANCHORMUD_";

    public static final String TIME_RATIO = "clock.time-ratio";
    public static final String START_SECONDS = "clock.start-seconds";
    public static final String BASE_ATTACK_INTERVAL = "combat.base-attack-interval";
    public static final String ROUND_SECONDS = "combat.round-seconds";
    public static final String PULSE_MILLIS = "combat.pulse-millis";
    public static final String MAX_REACTIONS = "combat.max-reactions-per-round";
    public static final String FLEE_WINDOW_SECONDS = "combat.flee-window-seconds";
    public static final String DISENGAGE_TIMEOUT_SECONDS = "combat.disengage-timeout-seconds";
    public static final String DISENGAGE_DIFFICULTY = "combat.disengage-difficulty";
    public static final String LEAVE_MODE = "combat.leave-mode";
    public static final String RESPAWN_ROOM = "combat.respawn-room";
    public static final String DISCONNECT_GRACE_SECONDS = "session.disconnect-grace-seconds";
    public static final String TALK_HOLD_SECONDS = "npc.talk-hold-seconds";
    public static final String ROOM_IDLE_HORIZON_SECONDS = "world.room-idle-horizon-seconds";
    public static final String ROOM_RESET_SECONDS = "world.room-reset-seconds";
    public static final String ITEM_EXPIRY_SECONDS = "world.item-expiry-seconds";
    public static final String LOOT_RESERVATION_SECONDS = "world.loot-reservation-seconds";
    public static final String SWEEP_MILLIS = "world.sweep-millis";
    public static final String ENCOUNTER_ROLL_CHANCE = "encounter.roll-chance";
    public static final String ENCOUNTER_COOLDOWN_SECONDS = "encounter.cooldown-seconds";
    public static final String ENCOUNTER_LIFETIME_SECONDS = "encounter.lifetime-seconds";
    public static final String PERSISTENCE_URL = "persistence.url";
    public static final String PERSISTENCE_USER = "persistence.user";
    public static final String PERSISTENCE_PASSWORD = "persistence.password";
    public static final String RETRY_ATTEMPTS = "persistence.retry-attempts";
    public static final String RETRY_BACKOFF_MILLIS = "persistence.retry-backoff-millis";

    private final Map<String, String> values;
    private final Map<String, String> env;

    private GameConfig(Map<String, String> values, Map<String, String> env) {
        this.values = Collections.unmodifiableMap(values);
        this.env = env;
    }

    /**
     * Load the default resource with system property and environment overrides.
     */
    public static GameConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static GameConfig load(String resourcePath) {
        Map<String, String> flat = new LinkedHashMap<>();
        try (InputStream in = GameConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("[GameConfig] {} not found on classpath, using built-in defaults", resourcePath);
            } else {
                Yaml yaml = new Yaml();
                Map<String, Object> root = yaml.load(in);
                flatten("", root, flat);
                logger.info("[GameConfig] Loaded {} keys from {}", flat.size(), resourcePath);
            }
        } catch (Exception e) {
            logger.error("[GameConfig] Failed to read {}: {}", resourcePath, e.getMessage());
        }
        return new GameConfig(flat, System.getenv());
    }

    /**
     * Build a configuration from explicit values, without overrides. Used by tests.
     */
    public static GameConfig of(Map<String, ?> overrides) {
        Map<String, String> flat = new LinkedHashMap<>();
        if (overrides != null) {
            for (Map.Entry<String, ?> e : overrides.entrySet()) {
                flat.put(e.getKey(), String.valueOf(e.getValue()));
            }
        }
        return new GameConfig(flat, Collections.emptyMap());
    }

    /**
     * Copy of this configuration with one more value.
     */
    public GameConfig with(String key, Object value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(key, String.valueOf(value));
        return new GameConfig(copy, env);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> node, Map<String, String> out) {
        if (node == null) return;
        for (Map.Entry<String, Object> e : node.entrySet()) {
            String key = prefix.isEmpty() ? e.getKey() : prefix + "." + e.getKey();
            Object v = e.getValue();
            if (v instanceof Map) {
                flatten(key, (Map<String, Object>) v, out);
            } else if (v != null) {
                out.put(key, String.valueOf(v));
            }
        }
    }

    /**
     * Raw value after overrides, or null.
     */
    public String getRaw(String key) {
        String sys = System.getProperty(PROPERTY_PREFIX + key);
        if (sys != null) return sys;
        String envKey = ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        String e = env.get(envKey);
        if (e != null) return e;
        return values.get(key);
    }

    public String getString(String key, String def) {
        String v = getRaw(key);
        return v == null ? def : v;
    }

    public int getInt(String key, int def) {
        return parse(key, def, Integer::parseInt);
    }

    public long getLong(String key, long def) {
        return parse(key, def, Long::parseLong);
    }

    public double getDouble(String key, double def) {
        return parse(key, def, Double::parseDouble);
    }

    public boolean getBoolean(String key, boolean def) {
        String v = getRaw(key);
        if (v == null) return def;
        return "true".equalsIgnoreCase(v.trim()) || "yes".equalsIgnoreCase(v.trim());
    }

    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E def) {
        String v = getRaw(key);
        if (v == null) return def;
        try {
            return Enum.valueOf(type, v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("[GameConfig] Bad value '{}' for {}, using {}", v, key, def);
            return def;
        }
    }

    private <T> T parse(String key, T def, Function<String, T> parser) {
        String v = getRaw(key);
        if (v == null) return def;
        try {
            return parser.apply(v.trim());
        } catch (NumberFormatException e) {
            logger.warn("[GameConfig] Bad value '{}' for {}, using {}", v, key, def);
            return def;
        }
    }

    // ========== Typed accessors ==========

    public int timeRatio() { return getInt(TIME_RATIO, 3); }
    public long startSeconds() { return getLong(START_SECONDS, 28_800L); }
    public double baseAttackIntervalSeconds() { return getDouble(BASE_ATTACK_INTERVAL, 3.0); }
    public long roundMillis() { return Math.round(getDouble(ROUND_SECONDS, 3.0) * 1000.0); }
    public long pulseMillis() { return getLong(PULSE_MILLIS, 100L); }
    public int maxReactionsPerRound() { return getInt(MAX_REACTIONS, 1); }
    public long fleeWindowMillis() { return Math.round(getDouble(FLEE_WINDOW_SECONDS, 9.0) * 1000.0); }
    public long disengageTimeoutMillis() { return Math.round(getDouble(DISENGAGE_TIMEOUT_SECONDS, 6.0) * 1000.0); }
    public int disengageDifficulty() { return getInt(DISENGAGE_DIFFICULTY, 50); }
    public String respawnRoom() { return getString(RESPAWN_ROOM, "black_anchor_common"); }
    public long disconnectGraceMillis() { return getLong(DISCONNECT_GRACE_SECONDS, 60L) * 1000L; }
    public long talkHoldMillis() { return getLong(TALK_HOLD_SECONDS, 30L) * 1000L; }
    public long roomIdleHorizonMillis() { return getLong(ROOM_IDLE_HORIZON_SECONDS, 3600L) * 1000L; }
    public long roomResetMillis() { return getLong(ROOM_RESET_SECONDS, 3600L) * 1000L; }
    public long itemExpiryMillis() { return getLong(ITEM_EXPIRY_SECONDS, 900L) * 1000L; }
    public long lootReservationMillis() { return getLong(LOOT_RESERVATION_SECONDS, 60L) * 1000L; }
    public long sweepMillis() { return getLong(SWEEP_MILLIS, 5000L); }
    public double encounterRollChance() { return getDouble(ENCOUNTER_ROLL_CHANCE, 0.35); }
    public long encounterCooldownMillis() { return getLong(ENCOUNTER_COOLDOWN_SECONDS, 120L) * 1000L; }
    public long encounterLifetimeMillis() { return getLong(ENCOUNTER_LIFETIME_SECONDS, 600L) * 1000L; }
    public int retryAttempts() { return getInt(RETRY_ATTEMPTS, 5); }
    public long retryBackoffMillis() { return getLong(RETRY_BACKOFF_MILLIS, 500L); }
}
