package io.tick4j.internal.logging;

import io.tick4j.JobLogger;
import io.tick4j.core.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.Objects;

/**
 * Default {@link JobLogger}: forwards to SLF4J.
 *
 * <p>SLF4J has no levels above ERROR, so CRITICAL, ALERT and EMERGENCY are logged at ERROR with a
 * marker named after the severity, which logback filters and appenders can select on.
 */
public class Slf4jJobLogger implements JobLogger {

    public static final String DEFAULT_LOGGER_NAME = "io.tick4j.jobs";

    private final Logger log;

    public Slf4jJobLogger() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
    }

    public Slf4jJobLogger(Logger log) {
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    @Override
    public void log(Severity severity, String message) {
        Objects.requireNonNull(severity, "severity must not be null");
        switch (severity) {
            case DEBUG -> log.debug(message);
            case INFO, NOTICE -> log.info(message);
            case WARNING -> log.warn(message);
            case ERROR -> log.error(message);
            default -> log.error(markerFor(severity), message);
        }
    }

    static Marker markerFor(Severity severity) {
        return MarkerFactory.getMarker(severity.name());
    }
}
