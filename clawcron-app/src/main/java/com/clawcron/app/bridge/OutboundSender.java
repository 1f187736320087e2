package com.clawcron.app.bridge;

/**
 * Delivers a message to a recipient on a channel (chat platform, console).
 */
public interface OutboundSender {

    void send(OutboundMessage message);

    /**
     * @param channel channel name, e.g. "cli" or "telegram"
     * @param chatId  recipient on that channel
     * @param content message text
     */
    record OutboundMessage(String channel, String chatId, String content) {
    }
}
