package com.example.anchormud.net.commands;

import com.example.anchormud.net.CommandDefinition.Category;
import com.example.anchormud.net.CommandRegistry;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handles picking up items.
 */
public class ItemCommandHandler implements CommandHandler {

    private static final Set<String> SUPPORTED_COMMANDS = CommandRegistry.getCommandsByCategory(Category.ITEMS).stream()
            .map(cmd -> cmd.getName())
            .collect(Collectors.toUnmodifiableSet());

    @Override
    public boolean supports(String commandName) {
        return SUPPORTED_COMMANDS.contains(commandName);
    }

    @Override
    public boolean handle(CommandContext ctx) {
        if (!"get".equals(ctx.getCommandName())) {
            return false;
        }
        String item = ctx.getArgs();
        if (item.isEmpty()) {
            ctx.send("Get what?");
            return true;
        }
        ctx.report(ctx.runtime.pickUp(ctx.playerRef, item));
        return true;
    }
}
