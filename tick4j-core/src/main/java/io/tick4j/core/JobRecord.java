package io.tick4j.core;

import java.time.Instant;

/**
 * Persisted state of a job in a shared {@link JobStore}.
 *
 * <p>{@code running} is the cross-process ownership token: it is only {@code true} between a
 * successful {@link JobStore#claim(String, Instant)} and the matching {@link JobStore#reset(String, Instant)}.
 */
public record JobRecord(
        String id,
        boolean running,
        Instant dueAt
) {

    public boolean isDue(Instant now) {
        return !running && dueAt != null && !dueAt.isAfter(now);
    }
}
