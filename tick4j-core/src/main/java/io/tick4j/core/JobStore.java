package io.tick4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Shared persistence for job due-times and running state.
 *
 * <p>Several scheduler processes may use the same store concurrently. The only coordination
 * primitive is {@link #claim(String, Instant)}, which must be a single atomic conditional update.
 *
 * <p>Every method reports storage failures as {@link StoreException}.
 */
public interface JobStore {

    /**
     * Synchronize stored records with the registered job set.
     *
     * <p>Inserts {@code running=false, dueAt=initialDue} for ids missing from the store and deletes
     * records whose id is not a key of {@code initialDueById}, whether or not they are running.
     * Calling it again with the same keys has no effect.
     *
     * @param initialDueById registered ids mapped to the due time used when a record is created
     */
    ReconcileResult reconcile(Map<String, Instant> initialDueById);

    /**
     * Records with {@code dueAt <= now} and {@code running = false}, in no particular order.
     */
    List<JobRecord> fetchDue(Instant now);

    /**
     * Atomically flip {@code running} from false to true, provided the record is still due at {@code now}.
     *
     * <p>The due-time condition stops a process holding a stale {@link #fetchDue(Instant)} result from
     * claiming a record another process has already run and rescheduled.
     *
     * @return true only if this call took ownership; false if the record is running, not yet due, or gone
     */
    boolean claim(String id, Instant now);

    /**
     * Release ownership and move the due time forward.
     */
    void reset(String id, Instant nextDueAt);

    List<JobRecord> findAll();
}
