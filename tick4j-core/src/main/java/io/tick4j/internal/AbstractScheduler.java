package io.tick4j.internal;

import io.tick4j.Job;
import io.tick4j.JobLogger;
import io.tick4j.Scheduler;
import io.tick4j.core.ConfigurationException;
import io.tick4j.core.JobDefinition;
import io.tick4j.core.JobRegistry;
import io.tick4j.core.Severity;
import io.tick4j.utils.TimeMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Registration, duration handling and the run loop shared by all schedulers.
 * Subclasses decide how an expression is validated, which reference each tick sees, and what a tick does.
 */
public abstract class AbstractScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(AbstractScheduler.class);

    protected final JobRegistry registry = new JobRegistry();
    protected final TimeMatcher matcher;
    protected final Clock clock;

    private final JobLogger jobLogger;
    private final RunLoop runLoop;

    private volatile int minutes = 1;

    protected AbstractScheduler(JobLogger jobLogger, TimeMatcher matcher, Clock clock, Sleeper sleeper) {
        this.jobLogger = Objects.requireNonNull(jobLogger, "jobLogger must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.runLoop = new RunLoop(clock, Objects.requireNonNull(sleeper, "sleeper must not be null"));
    }

    @Override
    public Scheduler register(String id, String when, Job job) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Job id must not be blank");
        }
        if (job == null) {
            throw new ConfigurationException("Each job must be executable: " + id);
        }
        if (when == null) {
            throw new ConfigurationException("Time expression must not be null for job: " + id);
        }
        try {
            validateExpression(when);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid time expression for job " + id + ": " + e.getMessage(), e);
        }

        registry.add(new JobDefinition(id, when, job));
        log.debug("Job registered id={} when='{}'", id, when);
        return this;
    }

    @Override
    public void setDuration(int minutes) {
        this.minutes = minutes;
    }

    @Override
    public void setDuration(Number minutes) {
        if (minutes == null) {
            throw new ConfigurationException("minutes must be an integer, got null");
        }
        if (minutes instanceof Integer || minutes instanceof Short || minutes instanceof Byte) {
            setDuration(minutes.intValue());
            return;
        }
        try {
            if (minutes instanceof Long l) {
                setDuration(Math.toIntExact(l));
                return;
            }
            if (minutes instanceof BigInteger b) {
                setDuration(b.intValueExact());
                return;
            }
        } catch (ArithmeticException e) {
            throw new ConfigurationException("minutes out of range: " + minutes, e);
        }
        throw new ConfigurationException("minutes must be an integer, got " + minutes.getClass().getSimpleName() + " " + minutes);
    }

    @Override
    public int getDuration() {
        return minutes;
    }

    @Override
    public void process() {
        int requested = minutes;
        log.info("{} starting minutes={} jobs={}", getClass().getSimpleName(), requested, registry.size());

        int ticks = runLoop.run(requested, tickClock(), this::tick);
        afterRun(ticks);

        log.info("{} finished ticks={}", getClass().getSimpleName(), ticks);
    }

    @Override
    public JobLogger logger() {
        return jobLogger;
    }

    /**
     * @throws IllegalArgumentException if the expression cannot be evaluated by this scheduler
     */
    protected abstract void validateExpression(String expression);

    /**
     * Clock supplying tick references for one {@link #process()} call.
     */
    protected abstract TickClock tickClock();

    protected void afterRun(int ticks) {
    }

    /**
     * Forward to the {@link JobLogger}; a failing logger never interrupts a tick.
     */
    protected void report(Severity severity, String message) {
        try {
            jobLogger.log(severity, message);
        } catch (RuntimeException e) {
            log.warn("JobLogger failed severity={} message={}", severity, message, e);
        }
    }

    protected static String describe(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getName() : msg;
    }

    protected Instant now() {
        return clock.instant();
    }
}
