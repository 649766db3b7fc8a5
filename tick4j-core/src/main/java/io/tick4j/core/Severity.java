package io.tick4j.core;

import java.util.Locale;

public enum Severity {

    DEBUG(100),
    INFO(200),
    NOTICE(250),
    WARNING(300),
    ERROR(400),
    CRITICAL(500),
    ALERT(550),
    EMERGENCY(600);

    private final int value;

    Severity(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public boolean isAtLeast(Severity other) {
        return value >= other.value;
    }

    /**
     * Case-insensitive lookup, e.g. "critical" or "WARNING".
     */
    public static Severity parse(String level) {
        if (level == null || level.isBlank()) {
            throw new IllegalArgumentException("level must not be blank");
        }
        return Severity.valueOf(level.trim().toUpperCase(Locale.ROOT));
    }
}
