package com.clawcron.common.config;

import lombok.Data;

/**
 * Root configuration type for ClawCron.
 */
@Data
public class ClawCronConfig {

    /** Cron/scheduling settings. */
    private CronConfig cron;

    /** Delivery defaults for job results. */
    private DeliveryConfig delivery;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class CronConfig {
        private boolean enabled = true;
        /** Path of the jobs file; defaults to {@code <stateDir>/cron/jobs.json}. */
        private String store;
        /** Upper bound on one heartbeat wait, so external edits are noticed. */
        private long maxSleepMs = 60_000;
        private long minSleepMs = 100;
        /** Default IANA zone for cron expressions and naive "at" timestamps. */
        private String timezone;
        private int runLogLimit = 200;
    }

    @Data
    public static class DeliveryConfig {
        private String defaultChannel = "cli";
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";
    }
}
