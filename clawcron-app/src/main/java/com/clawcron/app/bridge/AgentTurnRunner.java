package com.clawcron.app.bridge;

import java.util.concurrent.CompletableFuture;

/**
 * Runs one agent turn for a scheduled job and yields the agent's reply.
 */
public interface AgentTurnRunner {

    CompletableFuture<String> runTurn(AgentTurnRequest request);

    /**
     * @param instruction text handed to the agent
     * @param sessionKey  conversation the turn belongs to ({@code cron:<jobId>})
     * @param channel     channel the reply is meant for
     * @param chatId      recipient the reply is meant for
     */
    record AgentTurnRequest(String instruction, String sessionKey, String channel, String chatId) {
    }
}
