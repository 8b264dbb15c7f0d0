package com.example.anchormud.net.commands;

import com.example.anchormud.combat.ActionOutcome;
import com.example.anchormud.combat.MinorAction;
import com.example.anchormud.net.CommandDefinition.Category;
import com.example.anchormud.net.CommandRegistry;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handles kill, maneuver, ready, advance, retreat, interact, disengage and join.
 */
public class CombatCommandHandler implements CommandHandler {

    private static final Set<String> SUPPORTED_COMMANDS = CommandRegistry.getCommandsByCategory(Category.COMBAT).stream()
            .map(cmd -> cmd.getName())
            .collect(Collectors.toUnmodifiableSet());

    @Override
    public boolean supports(String commandName) {
        return SUPPORTED_COMMANDS.contains(commandName);
    }

    @Override
    public boolean handle(CommandContext ctx) {
        String cmdName = ctx.getCommandName();

        switch (cmdName) {
            case "kill":
                return handleKillCommand(ctx);
            case "maneuver":
                return handleManeuverCommand(ctx);
            case "ready":
                return handleMinor(ctx, MinorAction.READY, ctx.cmd.firstArg(), "Ready which reaction?");
            case "advance":
                return handleMinor(ctx, MinorAction.ADVANCE, null, null);
            case "retreat":
                return handleMinor(ctx, MinorAction.RETREAT, null, null);
            case "interact":
                return handleMinor(ctx, MinorAction.INTERACT, ctx.getArgs(), null);
            case "disengage":
                ctx.report(ctx.runtime.disengage(ctx.playerRef));
                return true;
            case "join":
                ctx.report(ctx.runtime.joinCombat(ctx.playerRef));
                return true;
            default:
                return false;
        }
    }

    private boolean handleKillCommand(CommandContext ctx) {
        String target = ctx.cmd.firstArg();
        if (target.isEmpty()) {
            ctx.send("Kill whom?");
            return true;
        }
        ctx.report(ctx.runtime.attack(ctx.playerRef, target));
        return true;
    }

    private boolean handleManeuverCommand(CommandContext ctx) {
        String maneuver = ctx.cmd.firstArg();
        if (maneuver.isEmpty()) {
            ctx.send("Usage: maneuver <name> [target]");
            return true;
        }
        String target = ctx.cmd.restArgs();
        ActionOutcome outcome = ctx.runtime.useManeuver(ctx.playerRef, maneuver, target.isEmpty() ? null : target);
        ctx.report(outcome);
        return true;
    }

    private boolean handleMinor(CommandContext ctx, MinorAction action, String argument, String missingArgument) {
        if (missingArgument != null && (argument == null || argument.isEmpty())) {
            ctx.send(missingArgument);
            return true;
        }
        ctx.report(ctx.runtime.minorAction(ctx.playerRef, action, argument));
        return true;
    }
}
