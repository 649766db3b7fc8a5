package io.tick4j;

import java.time.Instant;

/**
 * Main scheduler API.
 *
 * <p>Jobs are registered under a unique id together with a time expression. Once {@link #process()}
 * is called the scheduler evaluates every job once per minute, for {@link #getDuration()} minutes,
 * and runs the ones that are due.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.register("nightly-report", "02:30", reports::send)
 *          .register("heartbeat", "i", monitor::ping);
 * scheduler.setDuration(5);
 * scheduler.process();
 * }</pre>
 */
public interface Scheduler {

    /**
     * Register a job.
     *
     * @param id   unique id within this scheduler
     * @param when time expression, interpreted by the scheduler's dialect
     * @param job  job body
     * @return this scheduler, for chaining
     * @throws io.tick4j.core.ConfigurationException on a duplicate or blank id, a null job, or an
     *                                                expression the scheduler cannot evaluate
     */
    Scheduler register(String id, String when, Job job);

    /**
     * Set the number of minutes (ticks) {@link #process()} runs. Values below one still run a single tick.
     */
    void setDuration(int minutes);

    /**
     * Same as {@link #setDuration(int)}, rejecting non-integral numbers.
     */
    void setDuration(Number minutes);

    int getDuration();

    /**
     * Run one evaluation pass against the given reference instant.
     */
    void tick(Instant reference);

    /**
     * Blocking call: runs {@link #tick(Instant)} once per minute until the duration is exhausted.
     */
    void process();

    JobLogger logger();
}
