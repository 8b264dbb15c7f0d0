package com.example.anchormud.net;

import com.example.anchormud.net.CommandDefinition.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Every player command with its aliases and category.
 */
public final class CommandRegistry {

    private static final List<CommandDefinition> COMMANDS = new ArrayList<>();
    private static final Map<String, CommandDefinition> BY_NAME = new HashMap<>();
    private static final Map<String, String> ALIAS_TO_CANONICAL = new HashMap<>();

    static {
        // ===== INFORMATION =====
        register("look", "look", "Look at your surroundings", Category.INFORMATION, List.of("l"));
        register("score", "score", "Show your health, stamina and fight status", Category.INFORMATION, List.of("stats"));
        register("inventory", "inventory", "List what you are carrying", Category.INFORMATION, List.of("i"));
        register("time", "time", "Tell the time of day", Category.INFORMATION);
        register("maneuvers", "maneuvers", "List the maneuvers you know", Category.INFORMATION);
        register("talk", "talk <someone>", "Strike up a conversation with someone", Category.INFORMATION);
        register("help", "help [command]", "List commands or describe one", Category.INFORMATION);

        // ===== MOVEMENT =====
        register("north", "north", "Move north", Category.MOVEMENT, List.of("n"));
        register("east", "east", "Move east", Category.MOVEMENT, List.of("e"));
        register("south", "south", "Move south", Category.MOVEMENT, List.of("s"));
        register("west", "west", "Move west", Category.MOVEMENT, List.of("w"));
        register("up", "up", "Move up", Category.MOVEMENT, List.of("u"));
        register("down", "down", "Move down", Category.MOVEMENT, List.of("d"));

        // ===== ITEMS =====
        register("get", "get <item>", "Pick up an item from the floor", Category.ITEMS, List.of("take"));

        // ===== COMBAT =====
        register("kill", "kill <target>", "Attack a target", Category.COMBAT, List.of("k", "attack"));
        register("maneuver", "maneuver <name> [target]", "Commit a maneuver this round", Category.COMBAT, List.of("m"));
        register("ready", "ready <reaction>", "Ready a reaction maneuver", Category.COMBAT);
        register("advance", "advance", "Close the distance (minor action)", Category.COMBAT);
        register("retreat", "retreat", "Fall back a range band (minor action)", Category.COMBAT);
        register("interact", "interact [what]", "Spend your minor action on something else", Category.COMBAT);
        register("disengage", "disengage", "Try to break away from the fight", Category.COMBAT, List.of("flee"));
        register("join", "join", "Join the fight in this room in support", Category.COMBAT, List.of("assist"));
    }

    private CommandRegistry() {
    }

    private static void register(String name, String usage, String description, Category category) {
        register(name, usage, description, category, Collections.emptyList());
    }

    private static void register(String name, String usage, String description, Category category, List<String> aliases) {
        CommandDefinition def = new CommandDefinition(name, usage, description, category, aliases);
        COMMANDS.add(def);
        BY_NAME.put(name, def);
        for (String alias : aliases) {
            ALIAS_TO_CANONICAL.put(alias, name);
            BY_NAME.put(alias, def);
        }
    }

    public static List<CommandDefinition> getAllCommands() {
        return Collections.unmodifiableList(COMMANDS);
    }

    /**
     * Definition by canonical name or alias, or null.
     */
    public static CommandDefinition getCommand(String nameOrAlias) {
        return nameOrAlias == null ? null : BY_NAME.get(nameOrAlias.toLowerCase());
    }

    public static List<CommandDefinition> getCommandsByCategory(Category category) {
        List<CommandDefinition> result = new ArrayList<>();
        for (CommandDefinition cmd : COMMANDS) {
            if (cmd.getCategory() == category) {
                result.add(cmd);
            }
        }
        return result;
    }

    /**
     * Resolve a possibly abbreviated command to its canonical name.
     * Exact names and aliases win; otherwise the first alphabetical prefix match.
     */
    public static String resolveCommand(String input) {
        if (input == null || input.isEmpty()) return null;
        String lower = input.toLowerCase();
        if (BY_NAME.containsKey(lower)) {
            String canonical = ALIAS_TO_CANONICAL.get(lower);
            return canonical != null ? canonical : lower;
        }
        Set<String> names = new TreeSet<>(BY_NAME.keySet());
        for (String name : names) {
            if (name.startsWith(lower)) {
                String canonical = ALIAS_TO_CANONICAL.get(name);
                return canonical != null ? canonical : name;
            }
        }
        return null;
    }
}
