package io.tick4j.internal.memory;

import io.tick4j.core.JobRecord;
import io.tick4j.core.JobStore;
import io.tick4j.core.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link JobStore} backed by a concurrent map. Shared between scheduler instances of one JVM;
 * claims are atomic per record.
 */
public class InMemoryJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final ConcurrentHashMap<String, JobRecord> records = new ConcurrentHashMap<>();

    @Override
    public ReconcileResult reconcile(Map<String, Instant> initialDueById) {
        Objects.requireNonNull(initialDueById, "initialDueById must not be null");

        long inserted = 0;
        for (var e : initialDueById.entrySet()) {
            Instant due = Objects.requireNonNull(e.getValue(), "initial due time must not be null").truncatedTo(ChronoUnit.MINUTES);
            if (records.putIfAbsent(e.getKey(), new JobRecord(e.getKey(), false, due)) == null) {
                inserted++;
            }
        }

        AtomicLong deleted = new AtomicLong();
        records.keySet().removeIf(id -> {
            boolean orphan = !initialDueById.containsKey(id);
            if (orphan) {
                deleted.incrementAndGet();
            }
            return orphan;
        });

        return new ReconcileResult(inserted, deleted.get());
    }

    @Override
    public List<JobRecord> fetchDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        List<JobRecord> due = new ArrayList<>();
        for (JobRecord record : records.values()) {
            if (record.isDue(now)) {
                due.add(record);
            }
        }
        return due;
    }

    @Override
    public boolean claim(String id, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");
        AtomicBoolean claimed = new AtomicBoolean(false);
        records.computeIfPresent(id, (k, r) -> {
            if (!r.isDue(now)) {
                return r;
            }
            claimed.set(true);
            return new JobRecord(k, true, r.dueAt());
        });
        return claimed.get();
    }

    @Override
    public void reset(String id, Instant nextDueAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(nextDueAt, "nextDueAt must not be null");
        JobRecord updated = records.computeIfPresent(id,
                (k, r) -> new JobRecord(k, false, nextDueAt.truncatedTo(ChronoUnit.MINUTES)));
        if (updated == null) {
            log.warn("reset found no record id={}", id);
        }
    }

    @Override
    public List<JobRecord> findAll() {
        List<JobRecord> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(JobRecord::id));
        return all;
    }
}
