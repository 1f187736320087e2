package com.clawcron.gateway.cron;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cron job input normalization: coerces loose user or tool input into
 * well-typed {@link CronTypes.CronJobCreate} definitions.
 * <p>
 * Accepted keys (aliases separated by {@code |}): {@code name},
 * {@code message}, {@code type|kind}, {@code every_seconds|everyMs},
 * {@code cron_expr|expr}, {@code at|atMs}, {@code timezone|tz},
 * {@code deliver}, {@code channel}, {@code to}, {@code deleteAfterRun}.
 * A definition may be wrapped in a {@code job} or {@code data} object.
 */
public final class CronNormalize {

    private static final int DEFAULT_NAME_LENGTH = 30;

    private CronNormalize() {
    }

    /**
     * Build a create definition; failures throw {@link IllegalArgumentException}
     * with a message fit for the caller.
     *
     * @param defaultTz zone applied when the input names none; may be null
     */
    public static CronTypes.CronJobCreate normalizeCronJobCreate(Map<String, Object> raw, String defaultTz) {
        if (raw == null) {
            throw new IllegalArgumentException("job definition is required");
        }
        Map<String, Object> next = unwrapJob(raw);

        String message = stringValue(next.get("message"));
        if (message == null) {
            throw new IllegalArgumentException("message is required");
        }

        String tz = firstString(next, "timezone", "tz");
        if (tz == null) {
            tz = blankToNull(defaultTz);
        }
        if (tz != null && CronParse.resolveZone(tz) == null) {
            throw new IllegalArgumentException("unknown timezone: " + tz);
        }

        CronTypes.CronSchedule schedule = coerceSchedule(next, tz);

        CronTypes.CronPayload payload = CronTypes.CronPayload.builder()
                .kind(coercePayloadKind(first(next, "type", "kind")))
                .message(message)
                .deliver(Boolean.TRUE.equals(coerceBoolean(next.get("deliver"))))
                .channel(normalizeChannel(stringValue(next.get("channel"))))
                .to(stringValue(next.get("to")))
                .build();

        String name = stringValue(next.get("name"));
        if (name == null) {
            name = message.length() > DEFAULT_NAME_LENGTH ? message.substring(0, DEFAULT_NAME_LENGTH) : message;
        }

        return CronTypes.CronJobCreate.builder()
                .name(name)
                .schedule(schedule)
                .payload(payload)
                .deleteAfterRun(Boolean.TRUE.equals(coerceBoolean(next.get("deleteAfterRun"))))
                .build();
    }

    /**
     * Normalize every entry of a batch; the first invalid entry fails the
     * whole batch, naming its position.
     */
    public static List<CronTypes.CronJobCreate> normalizeBatch(List<Map<String, Object>> raw, String defaultTz) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("batch is empty");
        }
        List<CronTypes.CronJobCreate> result = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            try {
                result.add(normalizeCronJobCreate(raw.get(i), defaultTz));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("job #" + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return result;
    }

    /**
     * Resolve the schedule: exactly one of every/cron/at must be present.
     */
    static CronTypes.CronSchedule coerceSchedule(Map<String, Object> next, String tz) {
        Object every = first(next, "every_seconds", "everyMs");
        String expr = firstString(next, "cron_expr", "expr");
        Object at = first(next, "at", "atMs");

        int given = (every != null ? 1 : 0) + (expr != null ? 1 : 0) + (at != null ? 1 : 0);
        if (given == 0) {
            throw new IllegalArgumentException("either every_seconds, cron_expr, or at is required");
        }
        if (given > 1) {
            throw new IllegalArgumentException("only one of every_seconds, cron_expr, or at may be given");
        }

        if (every != null) {
            Long value = coerceLong(every);
            if (value == null || value <= 0) {
                throw new IllegalArgumentException("interval must be a positive number: " + every);
            }
            long everyMs;
            try {
                everyMs = next.get("every_seconds") != null ? Math.multiplyExact(value, 1000L) : value;
                Math.addExact(System.currentTimeMillis(), everyMs);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("interval is too large: " + every);
            }
            return CronTypes.CronSchedule.every(everyMs);
        }

        if (expr != null) {
            if (!CronScheduleCalculator.isValidExpression(expr)) {
                throw new IllegalArgumentException("invalid cron expression: " + expr);
            }
            return CronTypes.CronSchedule.cron(expr, tz);
        }

        Long atMs = at instanceof Number n ? Long.valueOf(n.longValue())
                : CronParse.parseAbsoluteTimeMs(String.valueOf(at), tz);
        if (atMs == null || atMs <= 0) {
            throw new IllegalArgumentException("could not parse time: " + at);
        }
        return CronTypes.CronSchedule.builder()
                .kind(CronTypes.ScheduleKind.AT)
                .atMs(atMs)
                .tz(tz)
                .build();
    }

    /** "echo" only when asked for; "agent", "agent_turn" and "agentTurn" all mean a turn. */
    static CronTypes.PayloadKind coercePayloadKind(Object raw) {
        String kind = stringValue(raw);
        if (kind == null) {
            return CronTypes.PayloadKind.ECHO;
        }
        return switch (kind.toLowerCase()) {
            case "echo" -> CronTypes.PayloadKind.ECHO;
            case "agent", "agent_turn", "agentturn" -> CronTypes.PayloadKind.AGENT_TURN;
            default -> throw new IllegalArgumentException("unknown job type: " + kind);
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }

    private static Object first(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof String s && s.isBlank())
                continue;
            if (value != null)
                return value;
        }
        return null;
    }

    private static String firstString(Map<String, Object> map, String... keys) {
        return stringValue(first(map, keys));
    }

    private static String stringValue(Object value) {
        if (value == null)
            return null;
        return blankToNull(String.valueOf(value));
    }

    private static String blankToNull(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String normalizeChannel(String value) {
        return value == null ? null : value.toLowerCase();
    }

    private static Long coerceLong(Object value) {
        if (value instanceof Number n)
            return n.longValue();
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Boolean coerceBoolean(Object value) {
        if (value instanceof Boolean b)
            return b;
        if (value instanceof String s)
            return Boolean.parseBoolean(s.trim());
        return null;
    }
}
