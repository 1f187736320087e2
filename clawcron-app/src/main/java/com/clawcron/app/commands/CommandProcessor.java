package com.clawcron.app.commands;

import com.clawcron.common.config.ClawCronConfig;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Channel-agnostic command dispatcher.
 * Registers all command handlers and routes incoming commands to the
 * appropriate handler.
 */
@Slf4j
@Component
public class CommandProcessor {

    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    public CommandProcessor(CronCommands cronCommands) {
        handlers.put("cron", cronCommands::handleCron);
        handlers.put("help", this::handleHelp);
    }

    /**
     * Handle a slash command. Returns reply text if handled, null to pass through.
     *
     * @param command    the full command text (e.g. "/cron list --all")
     * @param sessionKey the session key
     * @param channel    the channel the command arrived on
     * @param senderId   the sender's ID, null for the command line
     * @param config     the current config
     * @return CommandResult with reply text, or null if the command is unknown
     */
    public CommandResult handleCommand(String command, String sessionKey, String channel,
            @Nullable String senderId, ClawCronConfig config) {
        if (command == null || command.isBlank()) {
            return null;
        }

        String trimmed = command.trim();
        if (!trimmed.startsWith("/")) {
            return null;
        }

        // Parse: "/cmd args..." → name="cmd", args="args..."
        String withoutSlash = trimmed.substring(1);
        int spaceIdx = indexOfWhitespace(withoutSlash);
        String name;
        String args;
        if (spaceIdx < 0) {
            name = withoutSlash.toLowerCase();
            args = "";
        } else {
            name = withoutSlash.substring(0, spaceIdx).toLowerCase();
            args = withoutSlash.substring(spaceIdx + 1).trim();
        }

        CommandHandler handler = handlers.get(name);
        if (handler == null) {
            log.debug("Unknown command: /{}", name);
            return null;
        }

        try {
            var ctx = new CommandContext(sessionKey, channel, senderId, config);
            return handler.handle(args, ctx);
        } catch (Exception e) {
            log.error("Command /{} failed: {}", name, e.getMessage(), e);
            return CommandResult.error("Command failed: " + e.getMessage());
        }
    }

    private CommandResult handleHelp(String args, CommandContext ctx) {
        StringBuilder sb = new StringBuilder("Available commands:\n");
        for (String name : handlers.keySet()) {
            sb.append("  /").append(name).append('\n');
        }
        sb.append('\n').append(CronCommands.USAGE);
        return CommandResult.text(sb.toString());
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
