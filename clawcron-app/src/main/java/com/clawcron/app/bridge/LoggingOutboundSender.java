package com.clawcron.app.bridge;

import lombok.extern.slf4j.Slf4j;

/**
 * Default sender when no chat channel is wired: writes deliveries to the log.
 */
@Slf4j
public class LoggingOutboundSender implements OutboundSender {

    @Override
    public void send(OutboundMessage message) {
        log.info("[{} → {}] {}", message.channel(), message.chatId(), message.content());
    }
}
