package io.autopilot4j.utils;

import org.quartz.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Parses the time specs used in configuration.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Daily time of day: "AT 00:05"</li>
 *   <li>Cron expressions, 5 or 6 fields: e.g. "0 0 * * *", "0 30 23 * * *"</li>
 *   <li>Human-readable intervals: "90 seconds", "15m", "1 hour 30 minutes"</li>
 * </ul>
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    /**
     * Next instant strictly after {@code from} that matches {@code spec}.
     *
     * <p>For a plain interval the result is {@code from + interval}.
     *
     * @param spec "AT HH:mm", a cron expression or a human-readable interval
     * @param zone zone the time of day or cron fields are interpreted in
     * @param from base instant
     */
    public static Instant nextOccurrence(String spec, ZoneId zone, Instant from) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(from, "from must not be null");

        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        if (s.regionMatches(true, 0, "AT ", 0, 3)) {
            LocalTime timeOfDay;
            try {
                timeOfDay = LocalTime.parse(s.substring(3).trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid time of day: " + spec, e);
            }
            ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);
            ZonedDateTime candidate = base.with(timeOfDay);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1).with(timeOfDay);
            }
            return candidate.toInstant();
        }

        if (looksLikeCron(s)) {
            return nextCronTime(normalizeCron(s), zone, from);
        }

        return from.plus(parseHumanDuration(s));
    }

    /**
     * Whether {@code spec} is accepted by {@link #nextOccurrence}.
     */
    public static boolean isValidSpec(String spec) {
        try {
            nextOccurrence(spec, ZoneId.of("UTC"), Instant.EPOCH);
            return true;
        } catch (IllegalArgumentException | NullPointerException e) {
            return false;
        }
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field cron (seconds first).
     * - Accepts 5-field cron by prepending seconds "0".
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        // Quartz wants exactly one of the two day fields to be '?'
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Instant nextCronTime(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (java.text.ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, e);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return next.toInstant();
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhd]$")) {
            long n = Long.parseLong(s.replaceAll("[^0-9]", ""));
            char unit = s.charAt(s.length() - 1);
            return switch (unit) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Duration total = Duration.ZERO;
        boolean seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    total = total.plusDays(n);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    total = total.plusHours(n);
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    total = total.plusMinutes(n);
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    total = total.plusSeconds(n);
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        if (total.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return total;
    }
}
