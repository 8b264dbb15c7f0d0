package com.example.anchormud.persistence;

/**
 * Key/value store for process-wide runtime settings (world seconds, regional weather).
 */
public interface SettingsStore {

    /**
     * @return the stored value, or null if the key is absent
     */
    String get(String key) throws PersistenceException;

    void put(String key, String value) throws PersistenceException;
}
