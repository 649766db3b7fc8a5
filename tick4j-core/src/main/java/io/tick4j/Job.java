package io.tick4j;

/**
 * Body of a scheduled job.
 *
 * <p>Anything thrown is caught per run and reported to the {@link JobLogger} at CRITICAL; it never stops the
 * scheduler or the other jobs of the same tick.
 */
@FunctionalInterface
public interface Job {
    void execute() throws Exception;
}
