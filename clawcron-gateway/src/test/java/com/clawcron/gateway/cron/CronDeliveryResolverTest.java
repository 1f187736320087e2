package com.clawcron.gateway.cron;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CronDeliveryResolverTest {

    private static CronTypes.CronJob job(boolean deliver, String channel, String to) {
        return CronTypes.CronJob.builder()
                .id("j1")
                .payload(CronTypes.CronPayload.builder().deliver(deliver).channel(channel).to(to).build())
                .build();
    }

    @Test
    void deliverWithRecipient_isRequested() {
        CronDeliveryResolver.DeliveryPlan plan = CronDeliveryResolver.resolve(job(true, "Telegram", " 42 "), "cli");
        assertTrue(plan.isRequested());
        assertEquals("telegram", plan.getChannel());
        assertEquals("42", plan.getTo());
    }

    @Test
    void missingChannel_fallsBackToDefault() {
        CronDeliveryResolver.DeliveryPlan plan = CronDeliveryResolver.resolve(job(true, " ", "42"), "cli");
        assertEquals("cli", plan.getChannel());
    }

    @Test
    void deliverWithoutRecipient_isNotRequested() {
        assertFalse(CronDeliveryResolver.resolve(job(true, "cli", null), "cli").isRequested());
        assertFalse(CronDeliveryResolver.resolve(job(false, "cli", "42"), "cli").isRequested());
    }
}
