package io.tick4j.internal;

import io.tick4j.JobLogger;
import io.tick4j.config.SchedulerProperties;
import io.tick4j.core.JobDefinition;
import io.tick4j.core.MatchResult;
import io.tick4j.core.Severity;
import io.tick4j.internal.logging.Slf4jJobLogger;
import io.tick4j.lock.FileLockGuard;
import io.tick4j.lock.LockGuard;
import io.tick4j.utils.TimeMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Scheduler that keeps its jobs in memory and matches them with the pattern dialect of {@link TimeMatcher}.
 *
 * <p>Jobs run sequentially on the calling thread in registration order. Each due job runs inside
 * the configured {@link LockGuard}: a {@link FileLockGuard} keeps two processes from running the
 * same job at once, {@link LockGuard#none()} disables locking.
 *
 * <p>The reference minute is captured when the scheduler is created and advances by exactly one
 * minute per tick, so a five minute run evaluates five consecutive minutes even if ticks drift.
 *
 * <pre>{@code
 * Scheduler scheduler = new InMemoryScheduler();
 * scheduler.register("cleanup", "H:00", cleaner::run)
 *          .register("digest", "Y-m-d 07:30", mailer::sendDigest);
 * scheduler.setDuration(60);
 * scheduler.process();
 * }</pre>
 */
public class InMemoryScheduler extends AbstractScheduler {
    private static final Logger log = LoggerFactory.getLogger(InMemoryScheduler.class);

    private final LockGuard lockGuard;

    private Instant nextReference;

    /**
     * File locking in {@code java.io.tmpdir}, SLF4J logging, system zone and clock.
     */
    public InMemoryScheduler() {
        this(new Slf4jJobLogger(), new FileLockGuard());
    }

    public InMemoryScheduler(JobLogger jobLogger, LockGuard lockGuard) {
        this(jobLogger, lockGuard, new TimeMatcher(), Clock.systemDefaultZone(), Sleeper.threadSleep());
    }

    public InMemoryScheduler(JobLogger jobLogger, LockGuard lockGuard, TimeMatcher matcher, Clock clock, Sleeper sleeper) {
        super(jobLogger, matcher, clock, sleeper);
        this.lockGuard = Objects.requireNonNull(lockGuard, "lockGuard must not be null");
        this.nextReference = clock.instant().truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * Build a scheduler from properties: zone, duration, and file locking (or none).
     */
    public static InMemoryScheduler create(SchedulerProperties props, JobLogger jobLogger) {
        Objects.requireNonNull(props, "props must not be null");
        LockGuard guard = props.isLocking() ? new FileLockGuard(props.lockDirectoryPath()) : LockGuard.none();
        InMemoryScheduler scheduler = new InMemoryScheduler(
                jobLogger != null ? jobLogger : new Slf4jJobLogger(),
                guard,
                new TimeMatcher(props.zoneId()),
                Clock.systemDefaultZone(),
                Sleeper.threadSleep()
        );
        scheduler.setDuration(props.getMinutes());
        return scheduler;
    }

    @Override
    public void tick(Instant reference) {
        Objects.requireNonNull(reference, "reference must not be null");

        for (JobDefinition definition : registry.all()) {
            MatchResult match = matcher.isDue(definition.expression(), reference);
            switch (match.status()) {
                case NOT_DUE -> log.trace("Job not due id={} reference={}", definition.id(), reference);
                case ERROR -> report(Severity.ERROR,
                        "Job " + definition.id() + " has an invalid time expression: " + match.reason());
                case DUE -> execute(definition, reference);
            }
        }
    }

    private void execute(JobDefinition definition, Instant reference) {
        log.debug("Job started id={} reference={}", definition.id(), reference);
        try {
            lockGuard.withExclusiveLock(definition.id(), definition.job());
            log.debug("Job succeeded id={}", definition.id());
        } catch (Exception e) {
            log.debug("Job failed id={} msg={}", definition.id(), e.getMessage(), e);
            report(Severity.CRITICAL, "Job " + definition.id() + " failed: " + describe(e));
        }
    }

    @Override
    protected void validateExpression(String expression) {
        matcher.validatePattern(expression);
    }

    @Override
    protected TickClock tickClock() {
        return TickClock.logical(nextReference);
    }

    // a later process() call continues with the minute after the last one evaluated
    @Override
    protected void afterRun(int ticks) {
        nextReference = nextReference.plus(RunLoop.TICK_INTERVAL.multipliedBy(ticks));
    }

    public LockGuard lockGuard() {
        return lockGuard;
    }
}
