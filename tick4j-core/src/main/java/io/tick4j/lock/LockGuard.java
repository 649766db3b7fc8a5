package io.tick4j.lock;

import io.tick4j.Job;

/**
 * Mutual exclusion for a named job.
 *
 * <p>Implementations block until the lock is available, run the body, and release the lock on
 * every exit path. Exceptions thrown by the body propagate unchanged.
 */
@FunctionalInterface
public interface LockGuard {

    void withExclusiveLock(String jobId, Job body) throws Exception;

    /**
     * Guard that runs the body without any locking.
     */
    static LockGuard none() {
        return (jobId, body) -> body.execute();
    }
}
