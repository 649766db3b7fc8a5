package io.tick4j.internal.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import io.tick4j.core.JobRecord;
import io.tick4j.core.JobStore;
import io.tick4j.core.ReconcileResult;
import io.tick4j.core.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * MongoDB persistence for job state, one document per job in {@value JobRecordDocument#COLLECTION}.
 *
 * <p>Claims are a single {@code updateFirst} filtered on {@code running = false} and {@code dueAt <= now};
 * the modified count tells the caller whether it won. This is safe when many processes poll the same collection.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the indexes the due-job query relies on. Not called automatically.
     */
    public void ensureIndexes() {
        translate("ensureIndexes", () -> {
            mongoTemplate.indexOps(JobRecordDocument.class).ensureIndex(JobRecordIndexes.dueRunningIndex());
            return null;
        });
    }

    /**
     * Inserts missing ids with an upsert that only sets fields on insert, so a concurrent reconcile in
     * another process cannot overwrite a record that already exists.
     */
    @Override
    public ReconcileResult reconcile(Map<String, Instant> initialDueById) {
        Objects.requireNonNull(initialDueById, "initialDueById must not be null");

        return translate("reconcile", () -> {
            Set<String> stored = new HashSet<>(storedIds());

            long inserted = 0;
            for (var e : initialDueById.entrySet()) {
                if (stored.contains(e.getKey())) {
                    continue;
                }
                Instant due = Objects.requireNonNull(e.getValue(), "initial due time must not be null")
                        .truncatedTo(ChronoUnit.MINUTES);
                Update insert = new Update()
                        .setOnInsert("running", false)
                        .setOnInsert("dueAt", due);
                UpdateResult r = mongoTemplate.upsert(byId(e.getKey()), insert, JobRecordDocument.class);
                if (r.getUpsertedId() != null) {
                    inserted++;
                }
            }

            long deleted = 0;
            if (stored.stream().anyMatch(id -> !initialDueById.containsKey(id))) {
                Query orphans = new Query(Criteria.where("_id").nin(initialDueById.keySet()));
                deleted = mongoTemplate.remove(orphans, JobRecordDocument.class).getDeletedCount();
            }

            return new ReconcileResult(inserted, deleted);
        });
    }

    @Override
    public List<JobRecord> fetchDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(Criteria.where("dueAt").lte(now).and("running").is(false));
        return translate("fetchDue", () -> toRecords(mongoTemplate.find(q, JobRecordDocument.class)));
    }

    @Override
    public boolean claim(String id, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(Criteria.where("_id").is(id).and("running").is(false).and("dueAt").lte(now));
        Update u = new Update().set("running", true);

        return translate("claim", () -> mongoTemplate.updateFirst(q, u, JobRecordDocument.class).getModifiedCount() == 1);
    }

    @Override
    public void reset(String id, Instant nextDueAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(nextDueAt, "nextDueAt must not be null");

        Update u = new Update()
                .set("running", false)
                .set("dueAt", nextDueAt.truncatedTo(ChronoUnit.MINUTES));

        UpdateResult r = translate("reset", () -> mongoTemplate.updateFirst(byId(id), u, JobRecordDocument.class));
        if (r.getMatchedCount() == 0) {
            log.warn("reset found no record id={}", id);
        }
    }

    @Override
    public List<JobRecord> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("_id")));
        return translate("findAll", () -> toRecords(mongoTemplate.find(q, JobRecordDocument.class)));
    }

    private List<String> storedIds() {
        Query q = new Query();
        q.fields().include("_id");

        List<JobRecordDocument> docs = mongoTemplate.find(q, JobRecordDocument.class);
        List<String> ids = new ArrayList<>(docs.size());
        for (JobRecordDocument d : docs) {
            if (d != null && d.getId() != null) {
                ids.add(d.getId());
            }
        }
        return ids;
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static List<JobRecord> toRecords(List<JobRecordDocument> docs) {
        List<JobRecord> records = new ArrayList<>(docs.size());
        for (JobRecordDocument d : docs) {
            records.add(d.toRecord());
        }
        return records;
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException e) {
            throw new StoreException("Mongo " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
