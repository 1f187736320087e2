package com.clawcron.app.commands;

/**
 * Result of a command handler execution.
 */
public record CommandResult(
        String text,
        boolean error) {

    /** Create a successful plain text result. */
    public static CommandResult text(String text) {
        return new CommandResult(text, false);
    }

    /** Create a failed result; the text explains what went wrong. */
    public static CommandResult error(String text) {
        return new CommandResult(text, true);
    }
}
