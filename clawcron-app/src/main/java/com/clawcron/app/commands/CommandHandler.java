package com.clawcron.app.commands;

/**
 * Functional interface for command handlers.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * Handle a command.
     *
     * @param args the command arguments (text after the command name), may be
     *             empty
     * @param ctx  the command context (session, sender, config)
     * @return CommandResult with reply text, or null if the command is not
     *         handled by this handler
     */
    CommandResult handle(String args, CommandContext ctx);
}
