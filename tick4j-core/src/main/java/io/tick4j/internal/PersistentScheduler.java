package io.tick4j.internal;

import io.tick4j.JobLogger;
import io.tick4j.config.SchedulerProperties;
import io.tick4j.core.JobDefinition;
import io.tick4j.core.JobRecord;
import io.tick4j.core.JobStore;
import io.tick4j.core.ReconcileResult;
import io.tick4j.core.Severity;
import io.tick4j.core.StoreException;
import io.tick4j.internal.logging.Slf4jJobLogger;
import io.tick4j.utils.TimeMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scheduler whose due times and running flags live in a shared {@link JobStore}, so several
 * processes with the same job set can run side by side without running a job twice at once.
 *
 * <p>Expressions use the relative dialect of {@link TimeMatcher#nextDue(String, Instant)}
 * ("every 5 minutes", "tomorrow 06:00", "0 2 * * *", ...).
 *
 * <p>One tick:
 * <ol>
 *   <li>reconcile: create records for new jobs, delete records of jobs no longer registered</li>
 *   <li>fetch records with {@code dueAt <= reference} that are not running</li>
 *   <li>for each: claim (atomic {@code running=false -> true} while still due); a lost claim means another
 *   process has it or already ran it</li>
 *   <li>run the job, then reset it with a due time computed from the expression and this tick's reference,
 *   never earlier than the following minute</li>
 * </ol>
 *
 * <p>A process that dies between claim and reset leaves the record running until an operator clears it.
 */
public class PersistentScheduler extends AbstractScheduler {
    private static final Logger log = LoggerFactory.getLogger(PersistentScheduler.class);

    private final JobStore jobStore;

    public PersistentScheduler(JobStore jobStore) {
        this(jobStore, new Slf4jJobLogger());
    }

    public PersistentScheduler(JobStore jobStore, JobLogger jobLogger) {
        this(jobStore, jobLogger, new TimeMatcher(), Clock.systemDefaultZone(), Sleeper.threadSleep());
    }

    public PersistentScheduler(JobStore jobStore, JobLogger jobLogger, TimeMatcher matcher, Clock clock, Sleeper sleeper) {
        super(jobLogger, matcher, clock, sleeper);
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
    }

    public static PersistentScheduler create(SchedulerProperties props, JobStore jobStore, JobLogger jobLogger) {
        Objects.requireNonNull(props, "props must not be null");
        PersistentScheduler scheduler = new PersistentScheduler(
                jobStore,
                jobLogger != null ? jobLogger : new Slf4jJobLogger(),
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

        reconcile(reference);

        List<JobRecord> due;
        try {
            due = jobStore.fetchDue(reference);
        } catch (StoreException e) {
            log.error("fetchDue failed reference={} msg={}", reference, e.getMessage(), e);
            report(Severity.CRITICAL, "Could not fetch due jobs: " + describe(e));
            return;
        }

        log.debug("Due jobs count={} reference={}", due.size(), reference);

        for (JobRecord record : due) {
            JobDefinition definition = registry.get(record.id());
            if (definition == null) {
                // registered by another process with a different job set
                log.debug("Skipping unknown job id={}", record.id());
                continue;
            }
            runClaimed(definition, reference);
        }
    }

    private void reconcile(Instant reference) {
        Map<String, Instant> initialDue = new LinkedHashMap<>();
        for (JobDefinition definition : registry.all()) {
            initialDue.put(definition.id(), matcher.nextDue(definition.expression(), reference));
        }

        try {
            ReconcileResult result = jobStore.reconcile(initialDue);
            if (result.hasEffect()) {
                log.info("Job store reconciled inserted={} deleted={}", result.inserted(), result.deleted());
            }
        } catch (StoreException e) {
            log.error("reconcile failed msg={}", e.getMessage(), e);
            report(Severity.CRITICAL, "Could not reconcile job store: " + describe(e));
        }
    }

    private void runClaimed(JobDefinition definition, Instant reference) {
        String id = definition.id();

        boolean claimed;
        try {
            claimed = jobStore.claim(id, reference);
        } catch (StoreException e) {
            log.warn("claim failed id={} msg={}", id, e.getMessage(), e);
            report(Severity.WARNING, "Could not claim job " + id + ", skipping this tick: " + describe(e));
            return;
        }
        if (!claimed) {
            log.debug("Job already running elsewhere id={}", id);
            return;
        }

        try {
            log.debug("Job started id={} reference={}", id, reference);
            definition.job().execute();
            log.debug("Job succeeded id={}", id);
        } catch (Exception e) {
            log.debug("Job failed id={} msg={}", id, e.getMessage(), e);
            report(Severity.CRITICAL, "Job " + id + " failed: " + describe(e));
        } finally {
            release(definition, reference);
        }
    }

    private void release(JobDefinition definition, Instant reference) {
        String id = definition.id();
        Instant next = matcher.nextDue(definition.expression(), reference);
        if (!next.isAfter(reference)) {
            // "now" and similar forms would make the job due again within the same minute
            next = reference.truncatedTo(ChronoUnit.MINUTES).plus(RunLoop.TICK_INTERVAL);
        }
        try {
            jobStore.reset(id, next);
            log.debug("Job rescheduled id={} dueAt={}", id, next);
        } catch (StoreException e) {
            log.error("reset failed id={} msg={}", id, e.getMessage(), e);
            report(Severity.CRITICAL,
                    "Stuck job " + id + ": could not reset after running, it stays marked running until cleared: "
                            + describe(e));
        }
    }

    @Override
    protected void validateExpression(String expression) {
        matcher.nextDue(expression, now());
    }

    @Override
    protected TickClock tickClock() {
        return TickClock.wall(clock);
    }

    public JobStore jobStore() {
        return jobStore;
    }
}
