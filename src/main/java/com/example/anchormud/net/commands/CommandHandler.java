package com.example.anchormud.net.commands;

/**
 * Processes one category of related commands.
 */
public interface CommandHandler {

    /**
     * Execute the command.
     *
     * @return true if the command was handled, false if not recognized
     */
    boolean handle(CommandContext ctx);

    /**
     * @param commandName canonical command name
     */
    boolean supports(String commandName);
}
