package io.tick4j.internal.jdbc;

import io.tick4j.config.SchedulerProperties;
import io.tick4j.core.ReconcileResult;
import io.tick4j.core.StoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private JdbcTemplate jdbc;

    @Test
    void claimShouldDependOnAffectedRowCount() {
        JdbcJobStore store = new JdbcJobStore(jdbc);
        String sql = "UPDATE tick4j_jobs SET running = TRUE WHERE id = ? AND running = FALSE AND due_at <= ?";
        when(jdbc.update(sql, "a", Timestamp.from(NOW))).thenReturn(1);
        when(jdbc.update(sql, "b", Timestamp.from(NOW))).thenReturn(0);

        assertThat(store.claim("a", NOW)).isTrue();
        assertThat(store.claim("b", NOW)).isFalse();
    }

    @Test
    void dataAccessFailuresShouldBecomeStoreExceptions() {
        JdbcJobStore store = new JdbcJobStore(jdbc, "cron_jobs");
        when(jdbc.update(anyString(), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.claim("a", NOW))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("claim")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void concurrentInsertShouldNotFailReconcile() {
        JdbcJobStore store = new JdbcJobStore(jdbc);
        when(jdbc.queryForList("SELECT id FROM tick4j_jobs", String.class)).thenReturn(new ArrayList<>(List.of("old")));
        when(jdbc.update(eq("INSERT INTO tick4j_jobs (id, running, due_at) VALUES (?, FALSE, ?)"), any(Object[].class)))
                .thenThrow(new DuplicateKeyException("already there"));
        when(jdbc.update("DELETE FROM tick4j_jobs WHERE id = ?", "old")).thenReturn(1);

        ReconcileResult result = store.reconcile(Map.of("report", NOW));

        assertThat(result).isEqualTo(new ReconcileResult(0, 1));
        verify(jdbc).update("DELETE FROM tick4j_jobs WHERE id = ?", "old");
    }

    @Test
    void unsafeTableNamesShouldBeRejected() {
        assertThatThrownBy(() -> new JdbcJobStore(jdbc, "jobs; DROP TABLE users"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JdbcJobStore(jdbc, "1jobs"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new JdbcJobStore(jdbc, "cron_jobs").table()).isEqualTo("cron_jobs");
    }

    @Test
    void createShouldUseConfiguredTableName() {
        Properties source = new Properties();
        source.setProperty("tick4j.table-name", "cron_jobs");

        assertThat(JdbcJobStore.create(jdbc, SchedulerProperties.from(source)).table()).isEqualTo("cron_jobs");
        assertThat(JdbcJobStore.create(jdbc, new SchedulerProperties()).table()).isEqualTo(JdbcJobStore.DEFAULT_TABLE);
    }
}
