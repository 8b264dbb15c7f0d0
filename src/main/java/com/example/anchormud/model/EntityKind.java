package com.example.anchormud.model;

/**
 * The closed set of things the entity registry can hold.
 */
public enum EntityKind {
    CREATURE("creature"),
    NPC("npc"),
    ITEM("item");

    private final String key;

    EntityKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isCombatant() {
        return this != ITEM;
    }

    public static EntityKind fromKey(String key) {
        if (key == null) return null;
        for (EntityKind k : values()) {
            if (k.key.equalsIgnoreCase(key.trim())) return k;
        }
        return null;
    }
}
