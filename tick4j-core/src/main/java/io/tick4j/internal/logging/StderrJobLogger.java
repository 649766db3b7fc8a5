package io.tick4j.internal.logging;

import io.tick4j.JobLogger;
import io.tick4j.core.Severity;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes each message on its own line to standard error, ignoring anything below {@code threshold}.
 * Useful for cron-driven runs where stderr is mailed to the operator.
 */
public class StderrJobLogger implements JobLogger {

    private final PrintStream out;
    private final Severity threshold;

    public StderrJobLogger() {
        this(System.err, Severity.DEBUG);
    }

    public StderrJobLogger(PrintStream out, Severity threshold) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.threshold = Objects.requireNonNull(threshold, "threshold must not be null");
    }

    @Override
    public void log(Severity severity, String message) {
        if (message == null || !severity.isAtLeast(threshold)) {
            return;
        }
        out.println(message);
    }
}
