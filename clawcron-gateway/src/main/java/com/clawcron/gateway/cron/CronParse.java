package com.clawcron.gateway.cron;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Cron date/time parsing utilities.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");

    /**
     * Normalize a date string to a UTC ISO-8601 string.
     * - If the string already has a timezone, return as-is.
     * - If it's a date only (2024-01-01), append T00:00:00Z.
     * - If it's a date-time without TZ (2024-01-01T12:00:00), append Z.
     */
    static String normalizeUtcIso(String raw) {
        if (ISO_TZ_RE.matcher(raw).find())
            return raw;
        if (ISO_DATE_RE.matcher(raw).matches())
            return raw + "T00:00:00Z";
        if (ISO_DATE_TIME_RE.matcher(raw).find())
            return raw + "Z";
        return raw;
    }

    /**
     * Parse an absolute time input and return epoch milliseconds, treating
     * timestamps without an offset as UTC.
     *
     * @return epoch milliseconds, or null if parsing fails
     */
    public static Long parseAbsoluteTimeMs(String input) {
        return parseAbsoluteTimeMs(input, null);
    }

    /**
     * Parse an absolute time input and return epoch milliseconds.
     * Accepts:
     * <ul>
     * <li>Numeric strings (interpreted as epoch ms)</li>
     * <li>ISO-8601 date/datetime strings with an offset</li>
     * <li>ISO-8601 date/datetime strings without an offset, read in
     * {@code zone} (UTC when {@code zone} is null or unknown)</li>
     * </ul>
     *
     * @return epoch milliseconds, or null if parsing fails
     */
    public static Long parseAbsoluteTimeMs(String input, String zone) {
        if (input == null)
            return null;
        String raw = input.trim();
        if (raw.isEmpty())
            return null;

        // Pure numeric → epoch ms
        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? n : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        ZoneId zoneId = resolveZone(zone);
        if (zoneId == null || ISO_TZ_RE.matcher(raw).find()) {
            return parseUtcIso(raw);
        }

        try {
            if (ISO_DATE_RE.matcher(raw).matches()) {
                return LocalDate.parse(raw).atStartOfDay(zoneId).toInstant().toEpochMilli();
            }
            return LocalDateTime.parse(raw).atZone(zoneId).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Resolve an IANA zone id, or null when blank or unrecognized.
     */
    public static ZoneId resolveZone(String zone) {
        if (zone == null || zone.isBlank())
            return null;
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static Long parseUtcIso(String raw) {
        try {
            return OffsetDateTime.parse(normalizeUtcIso(raw)).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Format epoch ms as an ISO-8601 UTC timestamp (minute precision) for
     * listings.
     */
    public static String formatUtc(Long epochMs) {
        if (epochMs == null)
            return "";
        return OffsetDateTime.ofInstant(Instant.ofEpochMilli(epochMs), ZoneOffset.UTC)
                .toLocalDateTime()
                .withSecond(0)
                .withNano(0)
                .toString()
                .replace('T', ' ');
    }
}
