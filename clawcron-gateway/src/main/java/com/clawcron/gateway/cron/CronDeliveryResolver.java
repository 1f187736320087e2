package com.clawcron.gateway.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cron delivery plan resolution.
 * Determines whether and where a job's result is delivered.
 */
public final class CronDeliveryResolver {

    private CronDeliveryResolver() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeliveryPlan {
        private String channel;
        private String to;
        /** True only when the payload asks for delivery and names a recipient. */
        private boolean requested;
    }

    /**
     * Resolve the delivery plan of a job, falling back to
     * {@code defaultChannel} when the payload names none.
     */
    public static DeliveryPlan resolve(CronTypes.CronJob job, String defaultChannel) {
        CronTypes.CronPayload payload = job.getPayload();
        String channel = payload != null ? normalizeChannel(payload.getChannel()) : null;
        String to = payload != null ? normalizeTo(payload.getTo()) : null;
        if (channel == null) {
            channel = normalizeChannel(defaultChannel);
        }

        return DeliveryPlan.builder()
                .channel(channel)
                .to(to)
                .requested(payload != null && payload.isDeliver() && to != null)
                .build();
    }

    private static String normalizeChannel(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim().toLowerCase();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String normalizeTo(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
