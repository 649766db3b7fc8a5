package io.tick4j.utils;

import io.tick4j.core.MatchResult;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a job is due, at minute granularity.
 *
 * <p>Two dialects:
 * <ul>
 *   <li>{@link #isDue(String, Instant)}: pattern dialect. The expression is rendered with
 *   {@link PatternRenderer} and the result is used as a regular expression anchored at the end of
 *   {@code now} formatted as {@value #CANONICAL_PATTERN}. {@code "i"} or {@code ""} match every minute,
 *   {@code "09:00"} matches 09:00 every day, {@code "H:00"} matches the top of every hour and
 *   {@code "H:(00|30)"} every half hour.</li>
 *   <li>{@link #nextDue(String, Instant)}: relative dialect, resolved by {@link RelativeTimeParser}.</li>
 * </ul>
 */
public class TimeMatcher {

    public static final String CANONICAL_PATTERN = "yyyy-MM-dd HH:mm";

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern(CANONICAL_PATTERN);

    private final ZoneId zone;

    public TimeMatcher() {
        this(ZoneId.systemDefault());
    }

    public TimeMatcher(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    public MatchResult isDue(String expression, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (expression == null) {
            return MatchResult.error("expression must not be null");
        }

        ZonedDateTime minute = now.truncatedTo(ChronoUnit.MINUTES).atZone(zone);
        String rendered;
        try {
            rendered = PatternRenderer.render(expression, minute);
        } catch (IllegalArgumentException e) {
            return MatchResult.error(e.getMessage());
        }

        Pattern pattern;
        try {
            pattern = Pattern.compile(rendered + "$");
        } catch (PatternSyntaxException e) {
            return MatchResult.error("Invalid pattern '" + expression + "': " + e.getDescription());
        }

        return pattern.matcher(CANONICAL.format(minute)).find() ? MatchResult.due() : MatchResult.notDue();
    }

    /**
     * @throws IllegalArgumentException if the expression is not a supported relative expression
     */
    public Instant nextDue(String expression, Instant referenceNow) {
        return RelativeTimeParser.resolve(expression, zone, referenceNow);
    }

    /**
     * Registration-time check for the pattern dialect. Rendered token values are digits and letters
     * only, so the regex syntax does not depend on the instant used here.
     *
     * @throws IllegalArgumentException on a dangling escape or invalid regex syntax
     */
    public void validatePattern(String expression) {
        String rendered = PatternRenderer.render(PatternRenderer.parse(expression), Instant.EPOCH.atZone(zone));
        try {
            Pattern.compile(rendered + "$");
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern '" + expression + "': " + e.getDescription(), e);
        }
    }
}
