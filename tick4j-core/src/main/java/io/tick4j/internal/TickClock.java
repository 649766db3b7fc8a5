package io.tick4j.internal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Supplies the reference instant handed to each tick of a {@link RunLoop}.
 */
public interface TickClock {

    /**
     * Reference instant for the upcoming tick, truncated to the minute.
     */
    Instant current();

    /**
     * Called by the loop after sleeping, before the next tick.
     */
    void advance();

    /**
     * Starts at {@code start} and moves exactly one minute per tick, regardless of how long ticks
     * and sleeps really took. Used by the in-memory schedulers so a multi-minute run sees each minute once.
     */
    static TickClock logical(Instant start) {
        return new Logical(start);
    }

    /**
     * Samples the wall clock at every tick. Used when several processes share one store.
     */
    static TickClock wall(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return new TickClock() {
            @Override
            public Instant current() {
                return clock.instant().truncatedTo(ChronoUnit.MINUTES);
            }

            @Override
            public void advance() {
            }
        };
    }

    final class Logical implements TickClock {
        private static final Duration STEP = Duration.ofMinutes(1);

        private Instant reference;

        private Logical(Instant start) {
            this.reference = Objects.requireNonNull(start, "start must not be null").truncatedTo(ChronoUnit.MINUTES);
        }

        @Override
        public Instant current() {
            return reference;
        }

        @Override
        public void advance() {
            reference = reference.plus(STEP);
        }
    }
}
