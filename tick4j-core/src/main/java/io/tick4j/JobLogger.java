package io.tick4j;

import io.tick4j.core.Severity;

/**
 * Sink for job failures and scheduler alarms.
 *
 * <p>Implementations must not assume they are on a critical path: a logger that throws is reported
 * through SLF4J and otherwise ignored by the scheduler.
 */
@FunctionalInterface
public interface JobLogger {

    void log(Severity severity, String message);

    default void critical(String message) {
        log(Severity.CRITICAL, message);
    }
}
