package com.example.anchormud.net.commands;

import com.example.anchormud.combat.AttackTicker;
import com.example.anchormud.combat.ParticipantState;
import com.example.anchormud.model.ItemTemplate;
import com.example.anchormud.model.ManeuverDefinition;
import com.example.anchormud.model.PlayerCharacter;
import com.example.anchormud.net.CommandDefinition;
import com.example.anchormud.net.CommandDefinition.Category;
import com.example.anchormud.net.CommandRegistry;
import com.example.anchormud.net.MessageType;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Handles look, score, inventory, time, talk, maneuvers and help.
 */
public class InformationCommandHandler implements CommandHandler {

    private static final Set<String> SUPPORTED_COMMANDS = CommandRegistry.getCommandsByCategory(Category.INFORMATION).stream()
            .map(cmd -> cmd.getName())
            .collect(Collectors.toUnmodifiableSet());

    @Override
    public boolean supports(String commandName) {
        return SUPPORTED_COMMANDS.contains(commandName);
    }

    @Override
    public boolean handle(CommandContext ctx) {
        switch (ctx.getCommandName()) {
            case "look":
                String roomId = ctx.runtime.getRegistry().roomOf(ctx.playerRef);
                ctx.send(MessageType.ROOM, ctx.runtime.renderRoom(roomId, ctx.playerRef));
                return true;
            case "score":
                return handleScoreCommand(ctx);
            case "inventory":
                return handleInventoryCommand(ctx);
            case "time":
                ctx.send(ctx.runtime.getClock().timeString());
                return true;
            case "talk":
                String who = ctx.cmd.restArgs();
                if (who.isEmpty()) {
                    ctx.send("Talk to whom?");
                    return true;
                }
                ctx.report(ctx.runtime.talk(ctx.playerRef, who));
                return true;
            case "maneuvers":
                return handleManeuversCommand(ctx);
            case "help":
                return handleHelpCommand(ctx);
            default:
                return false;
        }
    }

    private boolean handleScoreCommand(CommandContext ctx) {
        PlayerCharacter pc = ctx.runtime.getRegistry().getPlayer(ctx.playerRef);
        if (pc == null) return false;
        StringBuilder sb = new StringBuilder();
        sb.append(pc.getName()).append('\n');
        sb.append("Health: ").append(pc.getHp()).append('/').append(pc.getMaxHp());
        sb.append("  Stamina: ").append(pc.getStamina()).append('/').append(pc.getMaxStamina()).append('\n');
        sb.append("Accuracy: ").append(pc.getAccuracy()).append("  Avoidance: ").append(pc.getAvoidance()).append('\n');
        sb.append("Weapon: ").append(pc.getAttack().name());
        ParticipantState state = ctx.runtime.getCombat().getState(ctx.playerRef);
        if (state != null) {
            sb.append('\n').append("In combat: ").append(state.getDisplayName());
            AttackTicker ticker = ctx.runtime.getCombat().getTickers().get(ctx.playerRef);
            if (ticker != null) {
                sb.append(", attacking every %.1fs".formatted(ticker.getIntervalMillis() / 1000.0));
            }
        }
        ctx.send(MessageType.STATE, sb.toString());
        return true;
    }

    private boolean handleInventoryCommand(CommandContext ctx) {
        PlayerCharacter pc = ctx.runtime.getRegistry().getPlayer(ctx.playerRef);
        if (pc == null) return false;
        if (pc.getInventory().isEmpty()) {
            ctx.send("You are carrying nothing.");
            return true;
        }
        StringBuilder sb = new StringBuilder("You are carrying:");
        for (Map.Entry<String, Integer> e : pc.getInventory().entrySet()) {
            ItemTemplate template = ctx.runtime.getContent().getItemTemplate(e.getKey());
            String name = template == null ? e.getKey() : template.getName();
            sb.append("\n  ").append(name);
            if (e.getValue() > 1) sb.append(" (x").append(e.getValue()).append(')');
        }
        ctx.send(sb.toString());
        return true;
    }

    private boolean handleManeuversCommand(CommandContext ctx) {
        PlayerCharacter pc = ctx.runtime.getRegistry().getPlayer(ctx.playerRef);
        if (pc == null) return false;
        StringBuilder sb = new StringBuilder("Maneuvers you know:");
        boolean any = false;
        for (ManeuverDefinition m : ctx.runtime.getContent().getManeuvers()) {
            if (!pc.knowsManeuver(m.id())) continue;
            any = true;
            sb.append("\n  ").append(m.id()).append(" - ").append(m.name())
                    .append(" (").append(m.staminaCost()).append(" stamina");
            if (m.isReaction()) sb.append(", reaction");
            if (m.ranged()) sb.append(", ranged");
            sb.append(')');
        }
        ctx.send(any ? sb.toString() : "You know no maneuvers.");
        return true;
    }

    private boolean handleHelpCommand(CommandContext ctx) {
        String topic = ctx.cmd.firstArg();
        if (!topic.isEmpty()) {
            CommandDefinition def = CommandRegistry.getCommand(CommandRegistry.resolveCommand(topic));
            ctx.send(def == null ? "No help for '" + topic + "'." : def.getUsage() + " - " + def.getDescription());
            return true;
        }
        StringBuilder sb = new StringBuilder("Commands:");
        for (Category category : Category.values()) {
            Set<String> names = new TreeSet<>();
            for (CommandDefinition def : CommandRegistry.getCommandsByCategory(category)) {
                names.add(def.getDisplayName());
            }
            sb.append("\n  ").append(category.getDisplayName()).append(": ").append(String.join(", ", names));
        }
        ctx.send(sb.toString());
        return true;
    }
}
