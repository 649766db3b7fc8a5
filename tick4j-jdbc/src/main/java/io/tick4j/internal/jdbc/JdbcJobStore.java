package io.tick4j.internal.jdbc;

import io.tick4j.config.SchedulerProperties;
import io.tick4j.core.JobRecord;
import io.tick4j.core.JobStore;
import io.tick4j.core.ReconcileResult;
import io.tick4j.core.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Relational persistence for job state.
 *
 * <p>Schema (see {@link #createSchema()}):
 * <pre>
 * CREATE TABLE tick4j_jobs (
 *     id      VARCHAR(191) PRIMARY KEY,
 *     running BOOLEAN      NOT NULL DEFAULT FALSE,
 *     due_at  TIMESTAMP    NOT NULL
 * );
 * </pre>
 *
 * <p>A claim is one conditional {@code UPDATE ... WHERE running = FALSE AND due_at <= ?}; the affected row count
 * decides which process owns the job.
 */
public class JdbcJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    public static final String DEFAULT_TABLE = "tick4j_jobs";

    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

    private static final RowMapper<JobRecord> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp due = rs.getTimestamp("due_at");
        return new JobRecord(
                rs.getString("id"),
                rs.getBoolean("running"),
                due == null ? null : due.toInstant()
        );
    };

    private final JdbcTemplate jdbc;
    private final String table;

    public JdbcJobStore(JdbcTemplate jdbc) {
        this(jdbc, DEFAULT_TABLE);
    }

    public JdbcJobStore(JdbcTemplate jdbc, String table) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        Objects.requireNonNull(table, "table must not be null");
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        this.table = table;
    }

    /**
     * Store on the table named by {@code tick4j.table-name}.
     */
    public static JdbcJobStore create(JdbcTemplate jdbc, SchedulerProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        return new JdbcJobStore(jdbc, props.getTableName());
    }

    public String table() {
        return table;
    }

    /**
     * Create the table and its due-job index if they do not exist. Not called automatically.
     */
    public void createSchema() {
        translate("createSchema", () -> {
            jdbc.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "id VARCHAR(191) PRIMARY KEY, "
                    + "running BOOLEAN NOT NULL DEFAULT FALSE, "
                    + "due_at TIMESTAMP NOT NULL)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS " + table + "_due_idx ON " + table + " (running, due_at)");
            return null;
        });
    }

    @Override
    public ReconcileResult reconcile(Map<String, Instant> initialDueById) {
        Objects.requireNonNull(initialDueById, "initialDueById must not be null");

        return translate("reconcile", () -> {
            List<String> stored = jdbc.queryForList("SELECT id FROM " + table, String.class);

            long inserted = 0;
            for (var e : initialDueById.entrySet()) {
                if (stored.contains(e.getKey())) {
                    continue;
                }
                Instant due = Objects.requireNonNull(e.getValue(), "initial due time must not be null");
                try {
                    inserted += jdbc.update(
                            "INSERT INTO " + table + " (id, running, due_at) VALUES (?, FALSE, ?)",
                            e.getKey(),
                            timestamp(due)
                    );
                } catch (DuplicateKeyException dup) {
                    log.debug("Record inserted concurrently by another process id={}", e.getKey());
                }
            }

            long deleted = 0;
            for (String id : stored) {
                if (!initialDueById.containsKey(id)) {
                    deleted += jdbc.update("DELETE FROM " + table + " WHERE id = ?", id);
                }
            }

            return new ReconcileResult(inserted, deleted);
        });
    }

    @Override
    public List<JobRecord> fetchDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return translate("fetchDue", () -> jdbc.query(
                "SELECT id, running, due_at FROM " + table + " WHERE running = FALSE AND due_at <= ?",
                ROW_MAPPER,
                Timestamp.from(now)
        ));
    }

    @Override
    public boolean claim(String id, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");
        return translate("claim", () -> jdbc.update(
                "UPDATE " + table + " SET running = TRUE WHERE id = ? AND running = FALSE AND due_at <= ?",
                id,
                Timestamp.from(now)
        ) == 1);
    }

    @Override
    public void reset(String id, Instant nextDueAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(nextDueAt, "nextDueAt must not be null");

        int updated = translate("reset", () -> jdbc.update(
                "UPDATE " + table + " SET running = FALSE, due_at = ? WHERE id = ?",
                timestamp(nextDueAt),
                id
        ));
        if (updated == 0) {
            log.warn("reset found no record id={}", id);
        }
    }

    @Override
    public List<JobRecord> findAll() {
        return translate("findAll", () -> jdbc.query(
                "SELECT id, running, due_at FROM " + table + " ORDER BY id",
                ROW_MAPPER
        ));
    }

    private static Timestamp timestamp(Instant instant) {
        return Timestamp.from(instant.truncatedTo(ChronoUnit.MINUTES));
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("JDBC " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
