package io.tick4j.utils;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Date;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.quartz.CronExpression;

/**
 * Resolves relative time expressions into a concrete instant.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>"now"</li>
 *   <li>Offsets: "+1 minute", "+1 day 3 hours", "every 5 minutes", "every hour", "15m", "300" (seconds)</li>
 *   <li>Time of day: "09:00", "AT 09:00" (next occurrence after the reference), "today 09:00" (same as "09:00"), "tomorrow 09:00"</li>
 *   <li>Weekdays: "monday 09:00", "next monday", "next fri 18:30"</li>
 *   <li>Cron expressions with 5 or 6 fields, e.g. "*&#47;5 * * * *" or "0 0 2 * * *"</li>
 * </ul>
 * <p>
 * Results are truncated to the minute and depend only on the arguments.
 */
public final class RelativeTimeParser {

    private static final Pattern TIME_OF_DAY = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhdw])$");

    private static final Map<String, Duration> UNITS = Map.of(
            "second", Duration.ofSeconds(1),
            "minute", Duration.ofMinutes(1),
            "hour", Duration.ofHours(1),
            "day", Duration.ofDays(1),
            "week", Duration.ofDays(7),
            "month", Duration.ofDays(30)
    );

    private RelativeTimeParser() {
    }

    /**
     * Resolve {@code expression} relative to {@code reference}.
     *
     * @param expression relative time expression
     * @param zone       zone used for calendar fields; null means system default
     * @param reference  instant the expression is relative to
     * @throws IllegalArgumentException if the expression is not understood
     */
    public static Instant resolve(String expression, ZoneId zone, Instant reference) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        Objects.requireNonNull(reference, "reference must not be null");

        String s = expression.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        ZoneId z = zone != null ? zone : ZoneId.systemDefault();
        ZonedDateTime base = ZonedDateTime.ofInstant(reference, z);

        try {
            return resolveZoned(s, expression, base).toInstant().truncatedTo(ChronoUnit.MINUTES);
        } catch (ArithmeticException | DateTimeException e) {
            throw new IllegalArgumentException("Time expression out of range: " + expression, e);
        }
    }

    private static ZonedDateTime resolveZoned(String s, String original, ZonedDateTime base) {
        if (s.equals("now")) {
            return base;
        }

        if (s.startsWith("+")) {
            return base.plus(parseHumanDuration(s.substring(1)));
        }

        if (s.startsWith("every ")) {
            String rest = s.substring("every ".length()).trim();
            if (UNITS.containsKey(singular(rest))) {
                rest = "1 " + rest;
            }
            return base.plus(parseHumanDuration(rest));
        }

        if (s.startsWith("at ")) {
            return nextTimeOfDay(base, parseTimeOfDay(s.substring(3).trim()));
        }

        if (TIME_OF_DAY.matcher(s).matches()) {
            return nextTimeOfDay(base, parseTimeOfDay(s));
        }

        String[] parts = s.split("\\s+");

        if (parts[0].equals("today") || parts[0].equals("tomorrow")) {
            LocalTime time = parts.length > 1 ? parseTimeOfDay(parts[1]) : LocalTime.MIDNIGHT;
            requireMaxParts(parts, 2, original);
            if (parts[0].equals("tomorrow")) {
                return ZonedDateTime.of(base.toLocalDate().plusDays(1), time, base.getZone());
            }
            // a time already passed today rolls over to tomorrow
            return nextTimeOfDay(base, time);
        }

        if (parts[0].equals("next") && parts.length > 1) {
            DayOfWeek day = parseDayOfWeek(parts[1]);
            if (day != null) {
                requireMaxParts(parts, 3, original);
                LocalTime time = parts.length > 2 ? parseTimeOfDay(parts[2]) : LocalTime.MIDNIGHT;
                LocalDate date = base.toLocalDate().with(TemporalAdjusters.next(day));
                return ZonedDateTime.of(date, time, base.getZone());
            }
        }

        DayOfWeek day = parseDayOfWeek(parts[0]);
        if (day != null) {
            requireMaxParts(parts, 2, original);
            LocalTime time = parts.length > 1 ? parseTimeOfDay(parts[1]) : LocalTime.MIDNIGHT;
            ZonedDateTime candidate = ZonedDateTime.of(
                    base.toLocalDate().with(TemporalAdjusters.nextOrSame(day)), time, base.getZone());
            if (!candidate.isAfter(base)) {
                candidate = ZonedDateTime.of(
                        base.toLocalDate().with(TemporalAdjusters.next(day)), time, base.getZone());
            }
            return candidate;
        }

        if (s.matches("^\\d+$")) {
            return base.plus(parseHumanDuration(s));
        }

        if (looksLikeCron(original)) {
            return nextCronOccurrence(normalizeCron(original), base);
        }

        try {
            return base.plus(parseHumanDuration(s));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported time expression: " + original, e);
        }
    }

    /* ================= helper ================= */

    private static void requireMaxParts(String[] parts, int max, String original) {
        if (parts.length > max) {
            throw new IllegalArgumentException("Unsupported time expression: " + original);
        }
    }

    private static ZonedDateTime nextTimeOfDay(ZonedDateTime base, LocalTime time) {
        ZonedDateTime candidate = base.with(time);
        if (!candidate.isAfter(base)) {
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }

    static LocalTime parseTimeOfDay(String text) {
        Matcher m = TIME_OF_DAY.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid time of day (expected HH:mm): " + text);
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            throw new IllegalArgumentException("Time of day out of range: " + text);
        }
        return LocalTime.of(hour, minute);
    }

    static DayOfWeek parseDayOfWeek(String text) {
        for (DayOfWeek day : DayOfWeek.values()) {
            String full = day.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            String abbr = day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            if (text.equals(full) || text.equals(abbr)) {
                return day;
            }
        }
        return null;
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - 5 fields get a leading "0" seconds field.
     * - "*" in both day-of-month and day-of-week becomes "?" in day-of-week.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] f = s.split("\\s+");
        if (f.length == 5) {
            return quartzFields("0", f[0], f[1], f[2], f[3], f[4]);
        }
        if (f.length == 6) {
            return quartzFields(f[0], f[1], f[2], f[3], f[4], f[5]);
        }
        return s;
    }

    private static String quartzFields(String sec, String min, String hour, String dom, String month, String dow) {
        String dayOfWeek = ("*".equals(dom) && "*".equals(dow)) ? "?" : dow;
        return String.join(" ", sec, min, hour, dom, month, dayOfWeek);
    }

    public static boolean looksLikeCron(String spec) {
        if (spec == null) {
            return false;
        }
        int fields = spec.trim().split("\\s+").length;
        if (fields != 5 && fields != 6) {
            return false;
        }
        return CronExpression.isValidExpression(normalizeCron(spec));
    }

    static ZonedDateTime nextCronOccurrence(String cron, ZonedDateTime from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (java.text.ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(from.getZone()));

        Date next = exp.getNextValidTimeAfter(Date.from(from.toInstant()));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return ZonedDateTime.ofInstant(next.toInstant(), from.getZone());
    }

    /**
     * Parse "3 minutes", "1 day 2 hours", "15m" or a bare number of seconds.
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds = parseCount(s);
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            long n = parseCount(compact.group(1));
            return switch (compact.group(2).charAt(0)) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                default -> Duration.ofDays(7L * n);
            };
        }

        String[] tokens = s.split("\\s+");
        if (tokens.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Set<String> seen = new HashSet<>();
        Duration total = Duration.ZERO;
        for (int i = 0; i < tokens.length; i += 2) {
            long n = parseCount(tokens[i]);
            String unit = singular(tokens[i + 1]);
            Duration step = UNITS.get(unit);
            if (step == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + tokens[i + 1]);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }
            total = total.plus(step.multipliedBy(n));
        }
        return total;
    }

    private static long parseCount(String text) {
        try {
            long n = Long.parseLong(text);
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }
            return n;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number in interval: " + text);
        }
    }

    private static String singular(String unit) {
        return unit.endsWith("s") ? unit.substring(0, unit.length() - 1) : unit;
    }
}
