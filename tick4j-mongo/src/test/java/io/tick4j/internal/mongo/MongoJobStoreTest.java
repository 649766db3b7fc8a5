package io.tick4j.internal.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import io.tick4j.core.JobRecord;
import io.tick4j.core.StoreException;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private MongoTemplate mongoTemplate;

    @Test
    void claimShouldFilterOnRunningAndDueTime() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(JobRecordDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1L, 1L, null));
        MongoJobStore store = new MongoJobStore(mongoTemplate);

        assertThat(store.claim("report", NOW)).isTrue();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).updateFirst(query.capture(), any(UpdateDefinition.class), eq(JobRecordDocument.class));
        Document filter = query.getValue().getQueryObject();
        assertThat(filter.get("_id")).isEqualTo("report");
        assertThat(filter.get("running")).isEqualTo(false);
        assertThat(filter.get("dueAt", Document.class).get("$lte")).isEqualTo(NOW);
    }

    @Test
    void claimShouldFailWhenNothingWasModified() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(JobRecordDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0L, 0L, null));

        assertThat(new MongoJobStore(mongoTemplate).claim("report", NOW)).isFalse();
    }

    @Test
    void driverAndDataAccessFailuresShouldBecomeStoreExceptions() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(JobRecordDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(mongoTemplate.find(any(Query.class), eq(JobRecordDocument.class)))
                .thenThrow(new MongoException("not primary"));
        MongoJobStore store = new MongoJobStore(mongoTemplate);

        assertThatThrownBy(() -> store.claim("report", NOW))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("Mongo claim failed")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        assertThatThrownBy(() -> store.fetchDue(NOW))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("not primary");
    }

    @Test
    void fetchDueShouldMapDocumentsToRecords() {
        when(mongoTemplate.find(any(Query.class), eq(JobRecordDocument.class)))
                .thenReturn(List.of(new JobRecordDocument("report", false, NOW)));

        assertThat(new MongoJobStore(mongoTemplate).fetchDue(NOW))
                .containsExactly(new JobRecord("report", false, NOW));
    }
}
