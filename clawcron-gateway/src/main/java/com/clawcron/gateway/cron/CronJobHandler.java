package com.clawcron.gateway.cron;

import java.util.concurrent.CompletableFuture;

/**
 * Executes the payload of a due job and returns what was delivered.
 * <p>
 * Implementations may call an agent, send a chat message, or run a command.
 * A future that completes exceptionally (or a thrown exception) marks the run
 * as failed; the message becomes the job's {@code lastError}.
 */
@FunctionalInterface
public interface CronJobHandler {

    /**
     * @param job a snapshot of the job being run
     * @return the delivered text, or null when there was nothing to deliver
     */
    CompletableFuture<String> handle(CronTypes.CronJob job);
}
