package io.tick4j.internal.mongo;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the {@value JobRecordDocument#COLLECTION} collection.
 *
 * <p>Indexes are not created at startup; call {@link MongoJobStore#ensureIndexes()} or run the
 * equivalent mongosh command from your migrations:
 * <pre>
 * db.tick4j_jobs.createIndex({ running: 1, due_at: 1 }, { name: "idx_due_running" });
 * </pre>
 */
public final class JobRecordIndexes {

    public static final String IDX_DUE_RUNNING = "idx_due_running";

    private JobRecordIndexes() {
    }

    /**
     * Index for fetching due jobs.
     * Keys: running ASC, due_at ASC
     */
    public static Index dueRunningIndex() {
        return new Index()
                .on("running", Sort.Direction.ASC)
                .on("due_at", Sort.Direction.ASC)
                .named(IDX_DUE_RUNNING);
    }
}
