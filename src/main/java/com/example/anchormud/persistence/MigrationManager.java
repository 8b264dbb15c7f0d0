package com.example.anchormud.persistence;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each schema setup step once per database URL and key during the JVM's
 * lifetime, so constructing several DAOs does not repeat DDL.
 */
public final class MigrationManager {

    @FunctionalInterface
    public interface Migration {
        void run() throws PersistenceException;
    }

    private static final Set<String> executed = ConcurrentHashMap.newKeySet();

    private MigrationManager() { }

    public static void ensureMigration(String url, String key, Migration migration) throws PersistenceException {
        String id = url + "#" + (key == null ? "default" : key);
        if (executed.contains(id)) return;
        synchronized (MigrationManager.class) {
            if (executed.contains(id)) return;
            migration.run();
            executed.add(id);
        }
    }
}
