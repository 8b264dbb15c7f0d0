package com.example.anchormud.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade for the dedicated spawn log. Spawn, loot, death-drop and expiry
 * lines go to the "anchormud.spawn" logger, which logback routes to its own file.
 */
public final class SpawnEventLogger {

    private static final Logger SPAWN = LoggerFactory.getLogger("anchormud.spawn");

    private SpawnEventLogger() {
    }

    public static void info(String format, Object... args) {
        SPAWN.info(format, args);
    }

    public static void error(String format, Object... args) {
        SPAWN.error(format, args);
    }
}
