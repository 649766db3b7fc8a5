package io.tick4j.internal.mongo;

import io.tick4j.core.JobRecord;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted job state.
 */
@Document(collection = JobRecordDocument.COLLECTION)
public class JobRecordDocument {

    public static final String COLLECTION = "tick4j_jobs";

    @Id
    private String id;

    private boolean running;

    @Field(name = "due_at", write = Field.Write.ALWAYS)
    private Instant dueAt;

    public JobRecordDocument() {
    }

    public JobRecordDocument(String id, boolean running, Instant dueAt) {
        this.id = id;
        this.running = running;
        this.dueAt = dueAt;
    }

    public JobRecord toRecord() {
        return new JobRecord(id, running, dueAt);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public boolean isRunning() {
        return running;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    public Instant getDueAt() {
        return dueAt;
    }

    public void setDueAt(Instant dueAt) {
        this.dueAt = dueAt;
    }
}
