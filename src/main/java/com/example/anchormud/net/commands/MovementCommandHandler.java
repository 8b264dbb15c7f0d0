package com.example.anchormud.net.commands;

import com.example.anchormud.combat.ActionOutcome;
import com.example.anchormud.model.Direction;
import com.example.anchormud.net.CommandDefinition.Category;
import com.example.anchormud.net.CommandRegistry;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handles the six movement directions.
 */
public class MovementCommandHandler implements CommandHandler {

    private static final Set<String> SUPPORTED_COMMANDS = CommandRegistry.getCommandsByCategory(Category.MOVEMENT).stream()
            .map(cmd -> cmd.getName())
            .collect(Collectors.toUnmodifiableSet());

    @Override
    public boolean supports(String commandName) {
        return SUPPORTED_COMMANDS.contains(commandName);
    }

    @Override
    public boolean handle(CommandContext ctx) {
        Direction dir = Direction.fromString(ctx.getCommandName());
        if (dir == null) {
            return false;
        }
        ActionOutcome outcome = ctx.runtime.move(ctx.playerRef, dir);
        // the new room is rendered by the runtime on arrival
        if (!outcome.isAccepted()) {
            ctx.report(outcome);
        }
        return true;
    }
}
