package com.example.anchormud.net.commands;

import com.example.anchormud.net.CommandDefinition;
import com.example.anchormud.net.CommandParser;
import com.example.anchormud.net.CommandRegistry;
import com.example.anchormud.net.GameMessage;
import com.example.anchormud.world.WorldRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes parsed commands to their category handler.
 */
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final Map<CommandDefinition.Category, CommandHandler> handlers = new EnumMap<>(CommandDefinition.Category.class);
    private static boolean initialized = false;

    /**
     * Register the category handlers. Called once at startup.
     */
    public static synchronized void initialize() {
        if (initialized) return;
        handlers.put(CommandDefinition.Category.INFORMATION, new InformationCommandHandler());
        handlers.put(CommandDefinition.Category.MOVEMENT, new MovementCommandHandler());
        handlers.put(CommandDefinition.Category.ITEMS, new ItemCommandHandler());
        handlers.put(CommandDefinition.Category.COMBAT, new CombatCommandHandler());
        initialized = true;
    }

    /**
     * Dispatch a command to its category handler.
     *
     * @return true if a handler took the command
     */
    public static boolean dispatch(CommandContext ctx) {
        if (!initialized) initialize();
        String cmdName = ctx.getCommandName();
        CommandDefinition def = CommandRegistry.getCommand(cmdName);
        if (def == null) {
            return false;
        }
        CommandHandler handler = handlers.get(def.getCategory());
        if (handler == null || !handler.supports(cmdName)) {
            return false;
        }
        try {
            return handler.handle(ctx);
        } catch (RuntimeException e) {
            logger.error("[CommandDispatcher] '{}' from {} failed", cmdName, ctx.playerRef, e);
            ctx.send("Something went wrong. The harbor gods frown.");
            return true;
        }
    }

    /**
     * Parse and dispatch one input line, telling the player if it was not understood.
     */
    public static void execute(WorldRuntime runtime, String playerRef, String line) {
        if (line == null || line.isBlank()) return;
        CommandParser.Command cmd = CommandParser.parse(line);
        CommandContext ctx = new CommandContext(cmd, playerRef, runtime);
        if (cmd == null || !dispatch(ctx)) {
            runtime.getSessions().send(playerRef, GameMessage.notice("Huh?"));
        }
    }

    /**
     * Register a custom handler for a category. Used for testing or extensions.
     */
    public static synchronized void registerHandler(CommandDefinition.Category category, CommandHandler handler) {
        if (!initialized) initialize();
        handlers.put(category, handler);
    }
}
