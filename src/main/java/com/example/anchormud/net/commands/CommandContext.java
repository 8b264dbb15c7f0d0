package com.example.anchormud.net.commands;

import com.example.anchormud.combat.ActionOutcome;
import com.example.anchormud.net.CommandParser.Command;
import com.example.anchormud.net.GameMessage;
import com.example.anchormud.net.MessageType;
import com.example.anchormud.world.WorldRuntime;

/**
 * Everything a command handler needs: the parsed command, who issued it and
 * the runtime to act on.
 */
public class CommandContext {
    public final Command cmd;
    public final String playerRef;
    public final WorldRuntime runtime;

    public CommandContext(Command cmd, String playerRef, WorldRuntime runtime) {
        this.cmd = cmd;
        this.playerRef = playerRef;
        this.runtime = runtime;
    }

    public String getArgs() {
        return cmd.getArgs();
    }

    public String getCommandName() {
        return cmd.getName();
    }

    /**
     * Send a line to the issuing player.
     */
    public void send(MessageType type, String text) {
        runtime.getSessions().send(playerRef, new GameMessage(type, text));
    }

    public void send(String text) {
        send(MessageType.NOTICE, text);
    }

    /**
     * Show an intent's notice to the player, if it has one.
     */
    public void report(ActionOutcome outcome) {
        if (outcome.getNotice() != null && !outcome.getNotice().isEmpty()) {
            send(outcome.isAccepted() ? MessageType.STATE : MessageType.NOTICE, outcome.getNotice());
        }
    }
}
