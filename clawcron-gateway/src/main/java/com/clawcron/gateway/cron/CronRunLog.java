package com.clawcron.gateway.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Record of a cron job execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronRunLog {
    private String jobId;
    private String jobName;
    private long startedAtMs;
    private long finishedAtMs;
    private long durationMs;
    private CronTypes.RunStatus status;
    private String error;
    /** Text returned by the handler, if any. */
    private String output;
    /** Whether the run bypassed the schedule ({@code runJob}). */
    private boolean manual;
}
