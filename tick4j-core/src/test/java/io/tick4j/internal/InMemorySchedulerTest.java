package io.tick4j.internal;

import io.tick4j.JobLogger;
import io.tick4j.config.SchedulerProperties;
import io.tick4j.core.ConfigurationException;
import io.tick4j.core.LockException;
import io.tick4j.core.Severity;
import io.tick4j.lock.FileLockGuard;
import io.tick4j.lock.LockGuard;
import io.tick4j.utils.TimeMatcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySchedulerTest {

    private static final Instant START = Instant.parse("2026-01-01T08:59:30Z");

    private final List<String> logged = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();

    private InMemoryScheduler scheduler(JobLogger logger, LockGuard guard) {
        return new InMemoryScheduler(logger, guard, new TimeMatcher(ZoneOffset.UTC),
                Clock.fixed(START, ZoneOffset.UTC), sleeps::add);
    }

    private InMemoryScheduler scheduler() {
        return scheduler((severity, message) -> logged.add(severity + " " + message), LockGuard.none());
    }

    @Test
    void everyMinuteAndFixedMinuteJobsOverThreeMinutes() {
        AtomicInteger a = new AtomicInteger();
        AtomicInteger b = new AtomicInteger();
        InMemoryScheduler scheduler = scheduler();
        scheduler.register("A", "i", a::incrementAndGet)
                .register("B", "09:00", b::incrementAndGet);
        scheduler.setDuration(3);

        scheduler.process();

        assertThat(a.get()).isEqualTo(3);
        assertThat(b.get()).isEqualTo(1);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(60), Duration.ofSeconds(60));
        assertThat(logged).isEmpty();
    }

    @Test
    void failingJobShouldBeReportedOncePerTickAndNotStopTheLoop() {
        AtomicInteger other = new AtomicInteger();
        InMemoryScheduler scheduler = scheduler();
        scheduler.register("broken", "i", () -> {
            throw new IllegalStateException("disk full");
        });
        scheduler.register("other", "i", other::incrementAndGet);
        scheduler.setDuration(5);

        scheduler.process();

        assertThat(logged).hasSize(5).allMatch(line -> line.equals("CRITICAL Job broken failed: disk full"));
        assertThat(other.get()).isEqualTo(5);
    }

    @Test
    void exceptionWithoutMessageShouldBeReportedByClassName() {
        InMemoryScheduler scheduler = scheduler();
        scheduler.register("npe", "i", () -> {
            throw new NullPointerException();
        });

        scheduler.process();

        assertThat(logged).containsExactly("CRITICAL Job npe failed: java.lang.NullPointerException");
    }

    @Test
    void jobsShouldRunInRegistrationOrder() {
        List<String> order = new ArrayList<>();
        InMemoryScheduler scheduler = scheduler();
        scheduler.register("z", "", () -> order.add("z"))
                .register("a", "", () -> order.add("a"))
                .register("m", "", () -> order.add("m"));

        scheduler.tick(START);

        assertThat(order).containsExactly("z", "a", "m");
    }

    @Test
    void secondProcessShouldContinueWithTheFollowingMinute() {
        List<Instant> seen = new ArrayList<>();
        InMemoryScheduler scheduler = new InMemoryScheduler((s, m) -> { }, LockGuard.none(),
                new TimeMatcher(ZoneOffset.UTC), Clock.fixed(START, ZoneOffset.UTC), sleeps::add) {
            @Override
            public void tick(Instant reference) {
                seen.add(reference);
            }
        };
        scheduler.setDuration(2);

        scheduler.process();
        scheduler.process();

        assertThat(seen).containsExactly(
                Instant.parse("2026-01-01T08:59:00Z"),
                Instant.parse("2026-01-01T09:00:00Z"),
                Instant.parse("2026-01-01T09:01:00Z"),
                Instant.parse("2026-01-01T09:02:00Z"));
    }

    @Test
    void halfHourlyPatternShouldRunTwiceAnHour() {
        AtomicInteger runs = new AtomicInteger();
        InMemoryScheduler scheduler = scheduler();
        scheduler.register("half-hourly", "H:(00|30)", runs::incrementAndGet);
        scheduler.setDuration(61);

        scheduler.process();

        // 08:59 through 09:59
        assertThat(runs.get()).isEqualTo(2);
    }

    @Test
    void duplicateIdShouldBeRejected() {
        InMemoryScheduler scheduler = scheduler();
        scheduler.register("report", "i", () -> { });

        assertThatThrownBy(() -> scheduler.register("report", "H:00", () -> { }))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate job id: report");
    }

    @Test
    void invalidRegistrationsShouldBeRejected() {
        InMemoryScheduler scheduler = scheduler();

        assertThatThrownBy(() -> scheduler.register(" ", "i", () -> { }))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> scheduler.register("report", "i", null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Each job must be executable");
        assertThatThrownBy(() -> scheduler.register("report", null, () -> { }))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> scheduler.register("report", "H:\\", () -> { }))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid time expression for job report");
        assertThatThrownBy(() -> scheduler.register("report", "H:(00|30", () -> { }))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid pattern");
    }

    @Test
    void durationShouldOnlyAcceptIntegers() {
        InMemoryScheduler scheduler = scheduler();

        scheduler.setDuration(Long.valueOf(15));
        assertThat(scheduler.getDuration()).isEqualTo(15);
        scheduler.setDuration(BigInteger.valueOf(7));
        assertThat(scheduler.getDuration()).isEqualTo(7);

        assertThatThrownBy(() -> scheduler.setDuration(1.5))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("minutes must be an integer");
        assertThatThrownBy(() -> scheduler.setDuration((Number) null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> scheduler.setDuration(Long.MAX_VALUE))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("out of range");
        assertThat(scheduler.getDuration()).isEqualTo(7);
    }

    @Test
    void nonPositiveDurationShouldStillRunOneTick() {
        AtomicInteger runs = new AtomicInteger();
        InMemoryScheduler scheduler = scheduler();
        scheduler.register("A", "i", runs::incrementAndGet);
        scheduler.setDuration(0);

        scheduler.process();

        assertThat(runs.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void failingLoggerShouldNotAbortTheTick() {
        AtomicInteger after = new AtomicInteger();
        InMemoryScheduler scheduler = scheduler((severity, message) -> {
            throw new IllegalStateException("logger down");
        }, LockGuard.none());
        scheduler.register("broken", "i", () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.register("after", "i", after::incrementAndGet);

        scheduler.tick(START);

        assertThat(after.get()).isEqualTo(1);
    }

    @Test
    void dueJobsShouldRunInsideTheLockGuard() {
        List<String> locked = new ArrayList<>();
        LockGuard recording = (jobId, body) -> {
            locked.add(jobId);
            body.execute();
        };
        AtomicInteger runs = new AtomicInteger();
        InMemoryScheduler scheduler = scheduler((s, m) -> logged.add(m), recording);
        scheduler.register("due", "i", runs::incrementAndGet)
                .register("later", "23:59", runs::incrementAndGet);

        scheduler.tick(START);

        assertThat(locked).containsExactly("due");
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void lockFailureShouldBeReportedAsJobFailure() {
        InMemoryScheduler scheduler = scheduler((s, m) -> logged.add(s + " " + m), (jobId, body) -> {
            throw new LockException("cannot lock " + jobId, null);
        });
        scheduler.register("report", "i", () -> { });

        scheduler.tick(START);

        assertThat(logged).containsExactly("CRITICAL Job report failed: cannot lock report");
    }

    @Test
    void createShouldApplyProperties(@TempDir Path lockDir) {
        Properties source = new Properties();
        source.setProperty("tick4j.minutes", "4");
        source.setProperty("tick4j.timezone", "Europe/Berlin");
        source.setProperty("tick4j.lock-directory", lockDir.toString());

        InMemoryScheduler scheduler = InMemoryScheduler.create(SchedulerProperties.from(source), null);

        assertThat(scheduler.getDuration()).isEqualTo(4);
        assertThat(scheduler.lockGuard()).isInstanceOf(FileLockGuard.class);
        assertThat(((FileLockGuard) scheduler.lockGuard()).directory()).isEqualTo(lockDir);
        assertThat(scheduler.logger()).isNotNull();

        source.setProperty("tick4j.locking", "false");
        InMemoryScheduler unlocked = InMemoryScheduler.create(SchedulerProperties.from(source), (s, m) -> { });
        assertThat(unlocked.lockGuard()).isNotInstanceOf(FileLockGuard.class);
    }

    @Test
    void criticalDefaultShouldDelegateToLog() {
        List<Severity> severities = new ArrayList<>();
        JobLogger logger = (severity, message) -> severities.add(severity);

        logger.critical("x");

        assertThat(severities).containsExactly(Severity.CRITICAL);
    }
}
