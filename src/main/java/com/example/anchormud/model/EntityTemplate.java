package com.example.anchormud.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable blueprint shared by every instance spawned from it.
 * Each entity kind has its own subclass with a fixed required core;
 * anything else the content carries lands in the extension map.
 */
public abstract class EntityTemplate {

    private final String id;                      // Unique key (e.g., "dock_rat")
    private final String name;                    // Display name (e.g., "a dock rat")
    private final List<String> keywords;          // Targeting keywords
    private final Map<String, Object> extensions; // Optional content fields

    protected EntityTemplate(String id, String name, List<String> keywords, Map<String, Object> extensions) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("template id is required");
        this.id = id;
        this.name = name == null ? id : name;
        this.keywords = keywords == null ? Collections.emptyList() : List.copyOf(keywords);
        this.extensions = extensions == null ? Collections.emptyMap() : Map.copyOf(extensions);
    }

    public abstract EntityKind getKind();

    public String getId() { return id; }
    public String getName() { return name; }
    public List<String> getKeywords() { return keywords; }
    public Map<String, Object> getExtensions() { return extensions; }

    /**
     * Whether a player-typed target word refers to this template.
     */
    public boolean matchesKeyword(String word) {
        if (word == null || word.isBlank()) return false;
        String w = word.trim().toLowerCase(Locale.ROOT);
        if (id.equalsIgnoreCase(w)) return true;
        for (String k : keywords) {
            if (k.equalsIgnoreCase(w)) return true;
        }
        return name.toLowerCase(Locale.ROOT).contains(w);
    }
}
