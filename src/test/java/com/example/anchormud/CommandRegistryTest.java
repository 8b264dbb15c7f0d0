package com.example.anchormud;

import com.example.anchormud.net.CommandDefinition;
import com.example.anchormud.net.CommandParser;
import com.example.anchormud.net.CommandRegistry;
import com.example.anchormud.net.commands.CombatCommandHandler;
import com.example.anchormud.net.commands.CommandHandler;
import com.example.anchormud.net.commands.InformationCommandHandler;
import com.example.anchormud.net.commands.ItemCommandHandler;
import com.example.anchormud.net.commands.MovementCommandHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests to ensure the command registry is complete and consistent.
 */
public class CommandRegistryTest {

    @Test
    @DisplayName("All registered commands should resolve correctly")
    void allCommandsResolve() {
        for (CommandDefinition cmd : CommandRegistry.getAllCommands()) {
            String resolved = CommandRegistry.resolveCommand(cmd.getName());
            assertNotNull(resolved, "Command '" + cmd.getName() + "' should resolve");
            assertEquals(cmd.getName(), resolved, "Command should resolve to its canonical name");
        }
    }

    @Test
    @DisplayName("All aliases should resolve to their canonical command")
    void allAliasesResolve() {
        for (CommandDefinition cmd : CommandRegistry.getAllCommands()) {
            for (String alias : cmd.getAliases()) {
                assertEquals(cmd.getName(), CommandRegistry.resolveCommand(alias),
                        "Alias '" + alias + "' should resolve to '" + cmd.getName() + "'");
            }
        }
    }

    @Test
    @DisplayName("Command prefixes should resolve correctly")
    void prefixResolution() {
        assertEquals("north", CommandRegistry.resolveCommand("nor"));
        assertEquals("help", CommandRegistry.resolveCommand("hel"));
        assertEquals("inventory", CommandRegistry.resolveCommand("inv"));
        assertEquals("disengage", CommandRegistry.resolveCommand("dis"));
        // alphabetical: "maneuver" sorts before "maneuvers"
        assertEquals("maneuver", CommandRegistry.resolveCommand("man"));
        assertEquals("ready", CommandRegistry.resolveCommand("re"));

        assertEquals("kill", CommandRegistry.resolveCommand("k"));
        assertEquals("kill", CommandRegistry.resolveCommand("att"));
        assertEquals("disengage", CommandRegistry.resolveCommand("flee"));
        assertEquals("join", CommandRegistry.resolveCommand("assist"));
        assertEquals("get", CommandRegistry.resolveCommand("take"));
    }

    @Test
    @DisplayName("Every category should have at least one command")
    void allCategoriesHaveCommands() {
        for (CommandDefinition.Category category : CommandDefinition.Category.values()) {
            assertFalse(CommandRegistry.getCommandsByCategory(category).isEmpty(),
                    "Category '" + category.getDisplayName() + "' should have at least one command");
        }
    }

    @Test
    @DisplayName("All commands should have a non-empty description")
    void allCommandsHaveDescription() {
        for (CommandDefinition cmd : CommandRegistry.getAllCommands()) {
            assertNotNull(cmd.getDescription());
            assertFalse(cmd.getDescription().isEmpty(),
                    "Command '" + cmd.getName() + "' description should not be empty");
        }
    }

    @Test
    @DisplayName("Every registered command is supported by its category handler")
    void allCommandsHaveHandler() {
        Map<CommandDefinition.Category, CommandHandler> handlers = new EnumMap<>(CommandDefinition.Category.class);
        handlers.put(CommandDefinition.Category.INFORMATION, new InformationCommandHandler());
        handlers.put(CommandDefinition.Category.MOVEMENT, new MovementCommandHandler());
        handlers.put(CommandDefinition.Category.ITEMS, new ItemCommandHandler());
        handlers.put(CommandDefinition.Category.COMBAT, new CombatCommandHandler());

        List<String> missing = new ArrayList<>();
        for (CommandDefinition cmd : CommandRegistry.getAllCommands()) {
            CommandHandler handler = handlers.get(cmd.getCategory());
            if (handler == null || !handler.supports(cmd.getName())) {
                missing.add(cmd.getName());
            }
        }
        assertTrue(missing.isEmpty(), "Commands without a handler: " + missing);
    }

    @Test
    @DisplayName("CommandParser should use CommandRegistry for resolution")
    void commandParserUsesRegistry() {
        CommandParser.Command parsed = CommandParser.parse("n");
        assertNotNull(parsed);
        assertEquals("north", parsed.getName());

        parsed = CommandParser.parse("k rat");
        assertNotNull(parsed);
        assertEquals("kill", parsed.getName());
        assertEquals("rat", parsed.getArgs());
    }

    @Test
    @DisplayName("No duplicate command names or aliases")
    void noDuplicateNames() {
        Set<String> allNames = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (CommandDefinition cmd : CommandRegistry.getAllCommands()) {
            if (!allNames.add(cmd.getName())) duplicates.add(cmd.getName());
            for (String alias : cmd.getAliases()) {
                if (!allNames.add(alias)) duplicates.add(alias);
            }
        }
        assertTrue(duplicates.isEmpty(), "Duplicate command names/aliases found: " + duplicates);
    }

    @Test
    @DisplayName("Unknown commands should not resolve")
    void unknownCommandsDoNotResolve() {
        assertNull(CommandRegistry.resolveCommand("xyzzy"));
        assertNull(CommandRegistry.resolveCommand(""));
        assertNull(CommandRegistry.resolveCommand(null));
    }
}
