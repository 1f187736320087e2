package com.clawcron.app.bridge;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Default runner when no agent runtime is wired: every turn fails, so
 * agent-turn jobs record an error instead of silently succeeding.
 */
@Slf4j
public class UnavailableAgentTurnRunner implements AgentTurnRunner {

    @Override
    public CompletableFuture<String> runTurn(AgentTurnRequest request) {
        log.warn("No agent runtime configured; cannot run turn for {}", request.sessionKey());
        return CompletableFuture.failedFuture(new IllegalStateException("no agent runtime configured"));
    }
}
