package io.tick4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Repeats a tick once per minute.
 *
 * <p>Runs {@code max(minutes, 1)} ticks. After each tick except the last it sleeps
 * {@code max(60s - elapsed, 0)}, where {@code elapsed} is the wall-clock duration of that tick. A tick
 * that overruns the minute is followed immediately by the next one; no tick is skipped. Alignment to
 * wall-clock minute boundaries is not guaranteed.
 */
public class RunLoop {
    private static final Logger log = LoggerFactory.getLogger(RunLoop.class);

    public static final Duration TICK_INTERVAL = Duration.ofSeconds(60);

    private final Clock clock;
    private final Sleeper sleeper;

    public RunLoop(Clock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * @return number of ticks that were run; less than requested only if the thread was interrupted
     */
    public int run(int minutes, TickClock tickClock, Consumer<Instant> tick) {
        Objects.requireNonNull(tickClock, "tickClock must not be null");
        Objects.requireNonNull(tick, "tick must not be null");

        int iterations = Math.max(minutes, 1);
        int completed = 0;

        while (true) {
            Instant startedAt = clock.instant();
            Instant reference = tickClock.current();
            log.debug("Tick {}/{} reference={}", completed + 1, iterations, reference);

            tick.accept(reference);
            completed++;

            if (completed >= iterations) {
                break;
            }

            Duration wait = remainder(Duration.between(startedAt, clock.instant()));
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Run loop interrupted after {}/{} ticks", completed, iterations);
                break;
            }
            tickClock.advance();
        }
        return completed;
    }

    static Duration remainder(Duration elapsed) {
        Duration wait = TICK_INTERVAL.minus(elapsed);
        return wait.isNegative() ? Duration.ZERO : wait;
    }
}
