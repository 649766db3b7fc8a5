package io.tick4j.utils;

import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders date patterns written with the familiar single-letter format tokens (the PHP {@code date()} set).
 * <p>
 * Rendering happens in two passes: {@link #parse(String)} splits the pattern into tokens and literal
 * text, then {@link #render(List, ZonedDateTime)} substitutes every token. Characters that are not
 * tokens are copied unchanged; a backslash makes the following character literal.
 * <p>
 * Supported tokens:
 * <pre>
 *   Y  4-digit year          y  2-digit year
 *   m  month, 01-12          n  month, 1-12
 *   M  month, Jan-Dec        F  month, January-December
 *   d  day, 01-31            j  day, 1-31
 *   D  weekday, Mon-Sun      l  weekday, Monday-Sunday
 *   N  ISO weekday, 1-7      w  weekday, 0 (Sunday)-6
 *   H  hour, 00-23           G  hour, 0-23
 *   h  hour, 01-12           g  hour, 1-12
 *   a  am/pm                 A  AM/PM
 *   i  minute, 00-59         s  second, 00-59
 * </pre>
 */
public final class PatternRenderer {

    private static final Map<Character, Function<ZonedDateTime, String>> TOKENS = Map.ofEntries(
            Map.entry('Y', t -> String.format("%04d", t.getYear())),
            Map.entry('y', t -> String.format("%02d", t.getYear() % 100)),
            Map.entry('m', t -> String.format("%02d", t.getMonthValue())),
            Map.entry('n', t -> Integer.toString(t.getMonthValue())),
            Map.entry('M', t -> t.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH)),
            Map.entry('F', t -> t.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH)),
            Map.entry('d', t -> String.format("%02d", t.getDayOfMonth())),
            Map.entry('j', t -> Integer.toString(t.getDayOfMonth())),
            Map.entry('D', t -> t.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH)),
            Map.entry('l', t -> t.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH)),
            Map.entry('N', t -> Integer.toString(t.getDayOfWeek().getValue())),
            Map.entry('w', t -> Integer.toString(t.getDayOfWeek().getValue() % 7)),
            Map.entry('H', t -> String.format("%02d", t.getHour())),
            Map.entry('G', t -> Integer.toString(t.getHour())),
            Map.entry('h', t -> String.format("%02d", twelveHour(t))),
            Map.entry('g', t -> Integer.toString(twelveHour(t))),
            Map.entry('a', t -> t.getHour() < 12 ? "am" : "pm"),
            Map.entry('A', t -> t.getHour() < 12 ? "AM" : "PM"),
            Map.entry('i', t -> String.format("%02d", t.getMinute())),
            Map.entry('s', t -> String.format("%02d", t.getSecond()))
    );

    /**
     * One parsed piece of a pattern: either a format token or literal text.
     */
    public record Segment(Character token, String literal) {

        static Segment token(char c) {
            return new Segment(c, null);
        }

        static Segment literal(String text) {
            return new Segment(null, text);
        }

        public boolean isToken() {
            return token != null;
        }
    }

    private PatternRenderer() {
    }

    /**
     * First pass: split a pattern into tokens and literal runs.
     *
     * @throws IllegalArgumentException on a dangling escape character
     */
    public static List<Segment> parse(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }

        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                if (i + 1 >= pattern.length()) {
                    throw new IllegalArgumentException("Dangling escape at end of pattern: " + pattern);
                }
                literal.append(pattern.charAt(++i));
            } else if (TOKENS.containsKey(c)) {
                if (literal.length() > 0) {
                    segments.add(Segment.literal(literal.toString()));
                    literal.setLength(0);
                }
                segments.add(Segment.token(c));
            } else {
                literal.append(c);
            }
        }

        if (literal.length() > 0) {
            segments.add(Segment.literal(literal.toString()));
        }
        return Collections.unmodifiableList(segments);
    }

    /**
     * Second pass: substitute every token with the corresponding field of {@code at}.
     */
    public static String render(List<Segment> segments, ZonedDateTime at) {
        StringBuilder out = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isToken()) {
                out.append(TOKENS.get(segment.token()).apply(at));
            } else {
                out.append(segment.literal());
            }
        }
        return out.toString();
    }

    public static String render(String pattern, ZonedDateTime at) {
        return render(parse(pattern), at);
    }

    private static int twelveHour(ZonedDateTime t) {
        int h = t.getHour() % 12;
        return h == 0 ? 12 : h;
    }
}
