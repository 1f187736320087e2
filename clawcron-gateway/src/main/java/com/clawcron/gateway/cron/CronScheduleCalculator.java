package com.clawcron.gateway.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the next absolute run time of a schedule.
 * <p>
 * A {@code null} result means "no next occurrence": the job stays enabled but
 * dormant until its schedule is recomputed (re-enable, edit, reload).
 */
@Slf4j
public final class CronScheduleCalculator {

    private static final CronParser CRON_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private CronScheduleCalculator() {
    }

    /**
     * Next run time in epoch ms, or null.
     * <ul>
     * <li>{@code at}: the configured instant, even when it already passed, so a
     * job that was due while the service was down still fires once.</li>
     * <li>{@code every}: {@code nowMs + everyMs}; re-armed from the moment of
     * computation, so the period drifts by execution overhead.</li>
     * <li>{@code cron}: next match strictly after {@code nowMs}, evaluated in
     * the schedule's zone (UTC if unset or unknown).</li>
     * </ul>
     */
    public static Long computeNextRunAtMs(CronTypes.CronSchedule schedule, long nowMs) {
        if (schedule == null || schedule.getKind() == null) {
            return null;
        }
        return switch (schedule.getKind()) {
            case AT -> schedule.getAtMs();
            case EVERY -> nextEveryRunAtMs(schedule.getEveryMs(), nowMs);
            case CRON -> nextCronRunAtMs(schedule.getExpr(), schedule.getTz(), nowMs);
        };
    }

    /**
     * Whether {@code expr} is a valid five-field cron expression that fires
     * at least once more. {@code 0 0 31 2 *} parses but never matches.
     */
    public static boolean isValidExpression(String expr) {
        if (expr == null || expr.isBlank()) {
            return false;
        }
        try {
            Cron cron = CRON_PARSER.parse(expr.trim()).validate();
            return ExecutionTime.forCron(cron).nextExecution(ZonedDateTime.now(ZoneOffset.UTC)).isPresent();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Long nextEveryRunAtMs(Long everyMs, long nowMs) {
        if (everyMs == null || everyMs <= 0) {
            return null;
        }
        try {
            return Math.addExact(nowMs, everyMs);
        } catch (ArithmeticException e) {
            log.warn("cron: interval {}ms is out of range, job left without a next run", everyMs);
            return null;
        }
    }

    private static Long nextCronRunAtMs(String expr, String tz, long nowMs) {
        if (expr == null || expr.isBlank()) {
            return null;
        }
        ZoneId zone = resolveZoneOrUtc(tz);
        try {
            Cron cron = CRON_PARSER.parse(expr.trim());
            ZonedDateTime base = Instant.ofEpochMilli(nowMs).atZone(zone);
            Optional<ZonedDateTime> next = ExecutionTime.forCron(cron).nextExecution(base);
            return next.map(t -> t.toInstant().toEpochMilli()).orElse(null);
        } catch (IllegalArgumentException e) {
            log.error("cron: invalid expression '{}': {}", expr, e.getMessage());
            return null;
        }
    }

    private static ZoneId resolveZoneOrUtc(String tz) {
        if (tz == null || tz.isBlank()) {
            return ZoneOffset.UTC;
        }
        ZoneId zone = CronParse.resolveZone(tz);
        if (zone == null) {
            log.warn("cron: invalid timezone '{}', falling back to UTC", tz);
            return ZoneOffset.UTC;
        }
        return zone;
    }
}
