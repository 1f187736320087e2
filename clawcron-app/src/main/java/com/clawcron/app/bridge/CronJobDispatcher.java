package com.clawcron.app.bridge;

import com.clawcron.gateway.cron.CronDeliveryResolver;
import com.clawcron.gateway.cron.CronJobHandler;
import com.clawcron.gateway.cron.CronTypes;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Implements CronJobHandler, bridging the scheduler to delivery and the
 * agent.
 * <ul>
 * <li>{@code echo}: the message itself is sent to the recipient, if any, and
 * returned. No agent involvement.</li>
 * <li>{@code agent_turn}: the message becomes an instruction for one agent
 * turn in session {@code cron:<id>}; the reply is delivered when the job asks
 * for delivery.</li>
 * </ul>
 */
@Slf4j
public class CronJobDispatcher implements CronJobHandler {

    static final String EMPTY_RESPONSE_NOTICE = "⚠️ Agent produced empty response.";
    private static final String DEFAULT_CHAT_ID = "direct";

    private final OutboundSender sender;
    private final AgentTurnRunner agentTurnRunner;
    private final Supplier<String> defaultChannel;

    public CronJobDispatcher(OutboundSender sender, AgentTurnRunner agentTurnRunner, Supplier<String> defaultChannel) {
        this.sender = sender;
        this.agentTurnRunner = agentTurnRunner;
        this.defaultChannel = defaultChannel;
    }

    @Override
    public CompletableFuture<String> handle(CronTypes.CronJob job) {
        CronTypes.CronPayload payload = job.getPayload() != null ? job.getPayload() : new CronTypes.CronPayload();
        CronDeliveryResolver.DeliveryPlan plan = CronDeliveryResolver.resolve(job, defaultChannel.get());

        if (payload.getKind() == CronTypes.PayloadKind.ECHO) {
            if (plan.getTo() != null) {
                sender.send(new OutboundSender.OutboundMessage(plan.getChannel(), plan.getTo(), payload.getMessage()));
            }
            return CompletableFuture.completedFuture(payload.getMessage());
        }

        String instruction = "Execute this scheduled task: " + payload.getMessage() + "\n"
                + "Return the result as text.";
        AgentTurnRunner.AgentTurnRequest request = new AgentTurnRunner.AgentTurnRequest(
                instruction,
                "cron:" + job.getId(),
                plan.getChannel(),
                plan.getTo() != null ? plan.getTo() : DEFAULT_CHAT_ID);

        return agentTurnRunner.runTurn(request).thenApply(response -> {
            if (plan.isRequested()) {
                deliver(job, plan, response);
            }
            return response;
        });
    }

    private void deliver(CronTypes.CronJob job, CronDeliveryResolver.DeliveryPlan plan, String response) {
        if (response != null && !response.isBlank()) {
            sender.send(new OutboundSender.OutboundMessage(plan.getChannel(), plan.getTo(), response));
            return;
        }
        log.warn("cron: job {} produced empty response, sending notice instead", job.getId());
        sender.send(new OutboundSender.OutboundMessage(plan.getChannel(), plan.getTo(), EMPTY_RESPONSE_NOTICE));
        throw new IllegalStateException("Agent produced empty response for delivery job");
    }
}
