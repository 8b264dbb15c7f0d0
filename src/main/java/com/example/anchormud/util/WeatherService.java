package com.example.anchormud.util;

import com.example.anchormud.model.RangeBand;
import com.example.anchormud.model.RegionWeather;
import com.example.anchormud.model.Weather;
import com.example.anchormud.model.WeatherExposure;
import com.example.anchormud.persistence.DeferredWriteQueue;
import com.example.anchormud.persistence.PersistenceException;
import com.example.anchormud.persistence.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Regional weather.
 *
 * Every region has exactly one active {@link RegionWeather}. A new type is
 * rolled from a weighted transition table keyed by the current type, and only
 * when the region is evaluated on or after its next-change time. Rooms never
 * hold weather of their own, so two rooms in one region always agree.
 *
 * Weather affects:
 * - room rendering (an overlay line per exposure)
 * - ranged accuracy at the far band (fog)
 * - disengage difficulty (squall)
 */
public class WeatherService {
    private static final Logger logger = LoggerFactory.getLogger(WeatherService.class);

    public static final long INITIAL_CHANGE_SECONDS = 900;
    public static final int MIN_DURATION_SECONDS = 600;
    public static final int MAX_DURATION_SECONDS = 1800;

    public static final int FOG_RANGED_PENALTY = -15;
    public static final int SQUALL_DISENGAGE_PENALTY = 20;

    private static final String SETTINGS_PREFIX = "weather.";

    /** Default transition weights, keyed by current type. */
    public static final Map<Weather, Map<Weather, Integer>> DEFAULT_TRANSITIONS = buildDefaults();

    /**
     * Result of a region evaluation that produced a new type.
     */
    public record Transition(String regionId, Weather from, Weather to) {}

    private final GameClock clock;
    private final Map<Weather, Map<Weather, Integer>> transitions;
    private final Random rng;
    private final SettingsStore settings;       // may be null
    private final DeferredWriteQueue writes;     // may be null
    private final Map<String, RegionWeather> regions = new ConcurrentHashMap<>();
    private volatile BiConsumer<String, Weather> changeListener = (region, weather) -> { };

    public WeatherService(GameClock clock, Map<Weather, Map<Weather, Integer>> transitions, Random rng,
                          SettingsStore settings, DeferredWriteQueue writes) {
        this.clock = clock;
        this.transitions = transitions == null ? DEFAULT_TRANSITIONS : transitions;
        this.rng = rng == null ? new Random() : rng;
        this.settings = settings;
        this.writes = writes;
    }

    private static Map<Weather, Map<Weather, Integer>> buildDefaults() {
        Map<Weather, Map<Weather, Integer>> t = new EnumMap<>(Weather.class);
        t.put(Weather.CLEAR, weights(Weather.CLEAR, 50, Weather.FOG, 30, Weather.WIND, 20));
        t.put(Weather.FOG, weights(Weather.FOG, 40, Weather.CLEAR, 40, Weather.SQUALL, 20));
        t.put(Weather.WIND, weights(Weather.WIND, 50, Weather.CLEAR, 30, Weather.SQUALL, 20));
        t.put(Weather.SQUALL, weights(Weather.WIND, 50, Weather.CLEAR, 50));
        t.put(Weather.COLD_SNAP, weights(Weather.COLD_SNAP, 40, Weather.CLEAR, 60));
        t.put(Weather.SALT_RAIN, weights(Weather.SALT_RAIN, 50, Weather.CLEAR, 50));
        return Collections.unmodifiableMap(t);
    }

    /**
     * Build a weight row from alternating type/weight arguments.
     */
    public static Map<Weather, Integer> weights(Object... pairs) {
        Map<Weather, Integer> row = new EnumMap<>(Weather.class);
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            row.put((Weather) pairs[i], (Integer) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(row);
    }

    /**
     * Register a callback invoked after a region changes weather type.
     */
    public void setChangeListener(BiConsumer<String, Weather> listener) {
        this.changeListener = listener == null ? (r, w) -> { } : listener;
    }

    // ========== Persistence ==========

    /**
     * Load saved state for the given regions. Missing or unreadable entries start clear.
     */
    public void restore(Collection<String> regionIds) {
        if (settings == null) return;
        for (String regionId : regionIds) {
            try {
                RegionWeather saved = RegionWeather.decode(regionId, settings.get(SETTINGS_PREFIX + regionId));
                if (saved != null) {
                    regions.put(regionId, saved);
                    logger.info("[WeatherService] Restored {}: {}", regionId, saved.weather().getDisplayName());
                }
            } catch (PersistenceException e) {
                logger.warn("[WeatherService] Could not restore weather for {}: {}", regionId, e.getMessage());
            }
        }
    }

    private void persist(RegionWeather state) {
        if (settings == null || writes == null) return;
        String value = state.encode();
        writes.submit("weather " + state.regionId(), () -> settings.put(SETTINGS_PREFIX + state.regionId(), value));
    }

    // ========== Queries ==========

    /**
     * Current weather for a region, creating a clear record on first use.
     * Does not roll a transition.
     */
    public RegionWeather current(String regionId) {
        if (regionId == null) return null;
        return regions.computeIfAbsent(regionId, id -> {
            long now = clock.worldSeconds();
            RegionWeather fresh = new RegionWeather(id, Weather.CLEAR, 0, now,
                    now + INITIAL_CHANGE_SECONDS, 1 + rng.nextInt(Integer.MAX_VALUE - 1));
            persist(fresh);
            return fresh;
        });
    }

    /**
     * Evaluate a region: if its next-change time has passed, roll a new type.
     * Concurrent callers for one region are serialized by the map.
     *
     * @return the transition if the type changed, otherwise null
     */
    public Transition maybeUpdate(String regionId) {
        if (regionId == null) return null;
        current(regionId);
        long now = clock.worldSeconds();
        Transition[] out = new Transition[1];
        regions.compute(regionId, (id, state) -> {
            if (now < state.nextChangeAt()) {
                return state;
            }
            Weather next = rollNext(state.weather(), transitions, rng);
            int duration = MIN_DURATION_SECONDS + rng.nextInt(MAX_DURATION_SECONDS - MIN_DURATION_SECONDS + 1);
            int intensity = state.intensity() + (next != Weather.CLEAR ? 1 : -1);
            RegionWeather updated = new RegionWeather(id, next, intensity, now, now + duration, state.seed());
            persist(updated);
            if (next != state.weather()) {
                out[0] = new Transition(id, state.weather(), next);
            }
            return updated;
        });
        Transition t = out[0];
        if (t != null) {
            logger.info("[WeatherService] {}: {} -> {}", regionId, t.from().getDisplayName(), t.to().getDisplayName());
            changeListener.accept(regionId, t.to());
        } else {
            logger.debug("[WeatherService] {} remains {}", regionId, regions.get(regionId).weather().getDisplayName());
        }
        return t;
    }

    /**
     * Pick the next type from the row for {@code current}. Rows iterate in enum
     * order, so a fixed seed always yields the same result. A missing or empty
     * row transitions to CLEAR.
     */
    public static Weather rollNext(Weather current, Map<Weather, Map<Weather, Integer>> table, Random rng) {
        Map<Weather, Integer> row = table.get(current);
        if (row == null || row.isEmpty()) return Weather.CLEAR;
        int total = 0;
        for (int w : row.values()) total += Math.max(0, w);
        if (total <= 0) return Weather.CLEAR;
        int roll = rng.nextInt(total);
        for (Weather w : Weather.values()) {
            Integer weight = row.get(w);
            if (weight == null || weight <= 0) continue;
            if (roll < weight) return w;
            roll -= weight;
        }
        return Weather.CLEAR;
    }

    /**
     * Overlay line for a room, or null for indoor rooms and rooms without a region.
     */
    public String overlay(String regionId, WeatherExposure exposure) {
        if (regionId == null || exposure == null || !exposure.isAffected()) return null;
        return current(regionId).weather().getOverlay(exposure);
    }

    // ========== Modifiers ==========

    /**
     * Accuracy modifier for a ranged attack from the given band. Fog penalises the far band.
     */
    public int rangedAccuracyModifier(String regionId, WeatherExposure exposure, RangeBand band) {
        if (regionId == null || exposure == null || !exposure.isAffected() || band != RangeBand.FAR) return 0;
        RegionWeather state = current(regionId);
        if (state.weather() != Weather.FOG) return 0;
        return (int) Math.round(FOG_RANGED_PENALTY * state.intensityScale());
    }

    /**
     * Added to disengage difficulty. Squalls make breaking away harder.
     */
    public int disengageDifficultyModifier(String regionId, WeatherExposure exposure) {
        if (regionId == null || exposure == null || !exposure.isAffected()) return 0;
        RegionWeather state = current(regionId);
        if (state.weather() != Weather.SQUALL) return 0;
        return (int) Math.round(SQUALL_DISENGAGE_PENALTY * state.intensityScale());
    }

    /**
     * Replace a region's state directly. Used by admin tooling and tests.
     */
    public void force(RegionWeather state) {
        regions.put(state.regionId(), state);
        persist(state);
    }
}
