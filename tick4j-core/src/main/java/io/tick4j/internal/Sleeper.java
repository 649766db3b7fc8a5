package io.tick4j.internal;

import java.time.Duration;

/**
 * Waits between ticks. Replaced by a recording implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
