package io.tick4j.core;

/**
 * Outcome of matching a time expression against a reference instant.
 *
 * <p>{@code NOT_DUE} is the routine answer for most jobs on most ticks; {@code ERROR} means the
 * expression itself could not be evaluated.
 */
public record MatchResult(
        Status status,
        String reason
) {

    public enum Status {
        DUE,
        NOT_DUE,
        ERROR
    }

    private static final MatchResult DUE = new MatchResult(Status.DUE, null);
    private static final MatchResult NOT_DUE = new MatchResult(Status.NOT_DUE, null);

    public static MatchResult due() {
        return DUE;
    }

    public static MatchResult notDue() {
        return NOT_DUE;
    }

    public static MatchResult error(String reason) {
        return new MatchResult(Status.ERROR, reason);
    }

    public boolean isDue() {
        return status == Status.DUE;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }
}
