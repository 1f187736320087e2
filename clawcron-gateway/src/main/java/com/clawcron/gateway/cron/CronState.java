package com.clawcron.gateway.cron;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Cron service state types: lifecycle events, construction dependencies,
 * heartbeat phases and the status summary.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Event types
    // =========================================================================

    public enum CronAction {
        ADDED, UPDATED, REMOVED, STARTED, FINISHED;

        public String key() {
            return name().toLowerCase();
        }
    }

    /**
     * Cron lifecycle event.
     */
    @Data
    @Builder
    public static class CronEvent {
        private String jobId;
        private CronAction action;
        private Long runAtMs;
        private Long durationMs;
        private CronTypes.RunStatus status;
        private String error;
        private String summary;
        private Long nextRunAtMs;
    }

    // =========================================================================
    // Dependencies
    // =========================================================================

    /**
     * Dependencies for cron service construction.
     */
    @Data
    @Builder
    public static class CronServiceDeps {
        private Path storePath;
        /** Executes due jobs; required. */
        private CronJobHandler handler;
        /** Optional lifecycle listener. */
        private Consumer<CronEvent> onEvent;
        @Builder.Default
        private long maxSleepMs = 60_000;
        @Builder.Default
        private long minSleepMs = 100;
        @Builder.Default
        private int runLogLimit = 200;
    }

    // =========================================================================
    // Heartbeat
    // =========================================================================

    public enum HeartbeatPhase {
        IDLE, CHECKING, DISPATCHING, WAITING, STOPPED
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Cron status summary for diagnostics.
     */
    @Data
    @Builder
    public static class CronStatusSummary {
        private boolean running;
        private String storePath;
        private int jobs;
        private int enabledJobs;
        private int inFlight;
        private Long nextWakeAtMs;
        private HeartbeatPhase phase;
    }
}
