package com.clawcron.app.commands;

import com.clawcron.common.config.ClawCronConfig;
import jakarta.annotation.Nullable;

/**
 * Context passed to every command handler.
 * <p>
 * {@code channel} and {@code senderId} identify where the command came from;
 * jobs created from a chat deliver back to that sender unless told otherwise.
 * The command line has no sender.
 */
public record CommandContext(
                String sessionKey,
                String channel,
                @Nullable String senderId,
                ClawCronConfig config) {
}
