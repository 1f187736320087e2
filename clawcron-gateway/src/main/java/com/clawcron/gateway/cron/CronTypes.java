package com.clawcron.gateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Cron job type definitions: schedule variants, typed payloads, run state,
 * the persisted job, the create DTO, and the store file format.
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT, EVERY, CRON;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        /** Unknown kinds map to {@code null}; such jobs never become due. */
        @JsonCreator
        public static ScheduleKind fromKey(String key) {
            if (key == null)
                return null;
            return switch (key.trim().toLowerCase()) {
                case "at" -> AT;
                case "every" -> EVERY;
                case "cron" -> CRON;
                default -> null;
            };
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronSchedule {
        private ScheduleKind kind;
        /** Absolute instant in epoch ms for "at" schedules. */
        private Long atMs;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        /** Five-field cron expression for "cron" schedules (e.g. "0 9 * * *"). */
        private String expr;
        /** IANA time zone; evaluated for "cron", display-only for "at". */
        private String tz;

        public static CronSchedule at(long atMs) {
            return CronSchedule.builder().kind(ScheduleKind.AT).atMs(atMs).build();
        }

        public static CronSchedule every(long everyMs) {
            return CronSchedule.builder().kind(ScheduleKind.EVERY).everyMs(everyMs).build();
        }

        public static CronSchedule cron(String expr, String tz) {
            return CronSchedule.builder().kind(ScheduleKind.CRON).expr(expr).tz(tz).build();
        }

        /** Short human-readable rendering for listings. */
        public String describe() {
            if (kind == null)
                return "unknown";
            return switch (kind) {
                case AT -> "one-time";
                case EVERY -> "every " + (everyMs != null ? everyMs / 1000 : 0) + "s";
                case CRON -> (expr != null ? expr : "") + (tz != null ? " (" + tz + ")" : "");
            };
        }
    }

    // =========================================================================
    // Payload
    // =========================================================================

    public enum PayloadKind {
        /** Deliver the message verbatim; no agent involvement. */
        ECHO,
        /** Hand the message to the agent as an instruction; deliver its reply. */
        AGENT_TURN;

        @JsonValue
        public String key() {
            return this == ECHO ? "echo" : "agent_turn";
        }

        @JsonCreator
        public static PayloadKind fromKey(String key) {
            if (key != null && "echo".equalsIgnoreCase(key.trim()))
                return ECHO;
            return AGENT_TURN;
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronPayload {
        @Builder.Default
        private PayloadKind kind = PayloadKind.AGENT_TURN;
        @Builder.Default
        private String message = "";
        private boolean deliver;
        private String channel;
        private String to;
    }

    // =========================================================================
    // Job state
    // =========================================================================

    public enum RunStatus {
        OK, ERROR;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static RunStatus fromKey(String key) {
            if (key == null)
                return null;
            return switch (key.trim().toLowerCase()) {
                case "ok" -> OK;
                case "error" -> ERROR;
                default -> null;
            };
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobState {
        private Long nextRunAtMs;
        private Long lastRunAtMs;
        /** {@code null} until the first run. */
        private RunStatus lastStatus;
        private String lastError;
    }

    // =========================================================================
    // Persisted job
    // =========================================================================

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJob {
        private String id;
        private String name;
        @Builder.Default
        private boolean enabled = true;
        private CronSchedule schedule;
        private CronPayload payload;
        @Builder.Default
        private CronJobState state = new CronJobState();
        private long createdAtMs;
        private long updatedAtMs;
        /** Only meaningful for "at" schedules. */
        private boolean deleteAfterRun;

        /**
         * Deep copy, so callers outside the store never share mutable state with
         * the in-memory collection.
         */
        public CronJob copy() {
            return toBuilder()
                    .schedule(schedule != null ? schedule.toBuilder().build() : null)
                    .payload(payload != null ? payload.toBuilder().build() : null)
                    .state(state != null ? state.toBuilder().build() : new CronJobState())
                    .build();
        }

        @JsonIgnore
        public boolean isOneShot() {
            return schedule != null && schedule.getKind() == ScheduleKind.AT;
        }
    }

    // =========================================================================
    // Create DTO
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobCreate {
        private String name;
        private CronSchedule schedule;
        private CronPayload payload;
        private boolean deleteAfterRun;
    }

    // =========================================================================
    // Store format
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronStoreFile {
        public static final int CURRENT_VERSION = 1;

        @Builder.Default
        private int version = CURRENT_VERSION;
        @Builder.Default
        private List<CronJob> jobs = new ArrayList<>();
    }
}
