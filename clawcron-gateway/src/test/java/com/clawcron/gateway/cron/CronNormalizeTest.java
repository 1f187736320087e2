package com.clawcron.gateway.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronNormalizeTest {

    @Test
    void everySeconds_becomesMillisecondInterval() {
        CronTypes.CronJobCreate create = CronNormalize.normalizeCronJobCreate(
                Map.of("message", "drink water", "every_seconds", 600), null);

        assertEquals(CronTypes.ScheduleKind.EVERY, create.getSchedule().getKind());
        assertEquals(600_000L, create.getSchedule().getEveryMs());
        assertEquals(CronTypes.PayloadKind.ECHO, create.getPayload().getKind());
        assertEquals("drink water", create.getName());
    }

    @Test
    void everyMsAlias_isTakenAsIs() {
        CronTypes.CronJobCreate create = CronNormalize.normalizeCronJobCreate(
                Map.of("message", "m", "everyMs", "1500"), null);
        assertEquals(1_500L, create.getSchedule().getEveryMs());
    }

    @Test
    void cronExpression_carriesZone() {
        CronTypes.CronJobCreate create = CronNormalize.normalizeCronJobCreate(
                Map.of("message", "report", "cron_expr", "0 12 * * *", "timezone", "Europe/Moscow",
                        "type", "agent"),
                null);

        assertEquals(CronTypes.ScheduleKind.CRON, create.getSchedule().getKind());
        assertEquals("0 12 * * *", create.getSchedule().getExpr());
        assertEquals("Europe/Moscow", create.getSchedule().getTz());
        assertEquals(CronTypes.PayloadKind.AGENT_TURN, create.getPayload().getKind());
    }

    @Test
    void defaultZone_appliesWhenNoneGiven() {
        CronTypes.CronJobCreate create = CronNormalize.normalizeCronJobCreate(
                Map.of("message", "m", "at", "2024-01-01T12:00:00"), "Europe/Moscow");

        assertEquals(CronTypes.ScheduleKind.AT, create.getSchedule().getKind());
        assertEquals(1704099600000L, create.getSchedule().getAtMs());
        assertEquals("Europe/Moscow", create.getSchedule().getTz());
    }

    @Test
    void naiveAt_withoutZone_isUtc() {
        CronTypes.CronJobCreate create = CronNormalize.normalizeCronJobCreate(
                Map.of("message", "m", "at", "2024-01-01T12:00:00", "deleteAfterRun", true), null);
        assertEquals(1704110400000L, create.getSchedule().getAtMs());
        assertTrue(create.isDeleteAfterRun());
    }

    @Test
    void longMessage_nameIsTruncated() {
        String message = "a reminder message that is clearly longer than thirty characters";
        CronTypes.CronJobCreate create = CronNormalize.normalizeCronJobCreate(
                Map.of("message", message, "every_seconds", 5), null);
        assertEquals(message.substring(0, 30), create.getName());
    }

    @Test
    void delivery_fieldsAreCarried() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("message", "m");
        raw.put("every_seconds", 5);
        raw.put("deliver", true);
        raw.put("channel", " Telegram ");
        raw.put("to", "42");
        CronTypes.CronPayload payload = CronNormalize.normalizeCronJobCreate(Map.of("job", raw), null).getPayload();

        assertTrue(payload.isDeliver());
        assertEquals("telegram", payload.getChannel());
        assertEquals("42", payload.getTo());
    }

    @Test
    void missingSchedule_isRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(Map.of("message", "m"), null));
        assertTrue(e.getMessage().contains("every_seconds, cron_expr, or at"));
    }

    @Test
    void twoSchedules_areRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(
                        Map.of("message", "m", "every_seconds", 5, "cron_expr", "* * * * *"), null));
    }

    @Test
    void missingMessage_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(Map.of("every_seconds", 5), null));
    }

    @ParameterizedTest
    @ValueSource(strings = { "not a cron", "99 * * * *", "0 0 31 2 *" })
    void invalidExpression_isRejected(String expr) {
        assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(Map.of("message", "m", "cron_expr", expr), null));
    }

    @Test
    void hugeInterval_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(
                        Map.of("message", "m", "every_seconds", Long.MAX_VALUE / 10), null));
        assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(
                        Map.of("message", "m", "everyMs", Long.MAX_VALUE - 10), null));
    }

    @Test
    void unknownTimezone_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(
                        Map.of("message", "m", "cron_expr", "0 9 * * *", "timezone", "Mars/Olympus"), null));
    }

    @Test
    void unparsableAt_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeCronJobCreate(Map.of("message", "m", "at", "tomorrow"), null));
    }

    @Test
    void batch_failureNamesPosition() {
        List<Map<String, Object>> batch = List.of(
                Map.of("message", "one", "every_seconds", 5),
                Map.of("message", "two"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CronNormalize.normalizeBatch(batch, null));
        assertTrue(e.getMessage().startsWith("job #2"));
    }

    @Test
    void batch_allValid() {
        List<CronTypes.CronJobCreate> creates = CronNormalize.normalizeBatch(List.of(
                Map.of("message", "one", "every_seconds", 5),
                Map.of("message", "two", "cron_expr", "*/5 * * * *"),
                Map.of("message", "three", "at", "2030-01-01T00:00:00Z")), null);
        assertEquals(3, creates.size());
    }
}
