package com.example.anchormud.net;

import java.util.Collections;
import java.util.List;

/**
 * Metadata for a single player command.
 */
public class CommandDefinition {

    public enum Category {
        INFORMATION("Information"),
        MOVEMENT("Movement"),
        ITEMS("Items"),
        COMBAT("Combat");

        private final String displayName;

        Category(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final String name;
    private final String usage;
    private final String description;
    private final Category category;
    private final List<String> aliases;

    public CommandDefinition(String name, String usage, String description, Category category, List<String> aliases) {
        this.name = name;
        this.usage = usage;
        this.description = description;
        this.category = category;
        this.aliases = aliases == null ? Collections.emptyList() : Collections.unmodifiableList(aliases);
    }

    public String getName() { return name; }
    public String getUsage() { return usage; }
    public String getDescription() { return description; }
    public Category getCategory() { return category; }
    public List<String> getAliases() { return aliases; }

    /**
     * Name for help listings, e.g. "north (n)".
     */
    public String getDisplayName() {
        if (aliases.isEmpty()) {
            return name;
        }
        return name + " (" + aliases.get(0) + ")";
    }
}
