package tech.agencydesk.platform.sequence;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteError;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.agencydesk.platform.scope.ScopeFieldMapping;
import tech.agencydesk.platform.scope.ScopedStoreFactory;
import tech.agencydesk.platform.testing.TestPlatformConfig;

import java.io.IOException;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Counter creation race: two first-time upserts on the same key, the loser
 * gets a duplicate-key error and must increment the counter the winner created.
 */
@ExtendWith(MockitoExtension.class)
class MongoSequenceCounterRetryTest {

    @Mock
    private MongoDatabase database;

    @Mock
    private MongoCollection<Document> counters;

    private MongoSequenceCounterRepository repository;

    @BeforeEach
    void setUp() {
        when(database.getCollection("sequence_counters")).thenReturn(counters);
        when(counters.getCodecRegistry()).thenReturn(MongoClientSettings.getDefaultCodecRegistry());

        repository = new MongoSequenceCounterRepository();
        repository.storeFactory = new ScopedStoreFactory(database, ScopeFieldMapping.standard());
        repository.config = new TestPlatformConfig();
    }

    @Test
    @DisplayName("incrementAndGet should retry once when the upsert loses a write race")
    void incrementAndGet_shouldRetry_whenUpsertHitsDuplicateKey() {
        MongoWriteException duplicate = new MongoWriteException(
            new WriteError(11000, "E11000 duplicate key error collection: sequence_counters", new BsonDocument()),
            new ServerAddress(), Set.of());
        when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenThrow(duplicate)
            .thenReturn(new Document("_id", "agency-a|KN|2026").append("seq", 2));

        assertThat(repository.incrementAndGet("agency-a", "KN", "2026")).isEqualTo(2L);

        verify(counters, times(2)).findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class));
    }

    @Test
    @DisplayName("incrementAndGet should retry once when findAndModify reports duplicate key")
    void incrementAndGet_shouldRetry_whenCommandReportsDuplicateKey() {
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
            .append("code", new BsonInt32(11000))
            .append("errmsg", new BsonString("E11000 duplicate key error"));
        when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenThrow(new MongoCommandException(response, new ServerAddress()))
            .thenReturn(new Document("seq", 1));

        assertThat(repository.incrementAndGet("agency-a", "KN", "2026")).isEqualTo(1L);
    }

    @Test
    @DisplayName("incrementAndGet should propagate a second duplicate-key failure")
    void incrementAndGet_shouldPropagate_whenRetryAlsoFails() {
        MongoWriteException duplicate = new MongoWriteException(
            new WriteError(11000, "E11000 duplicate key error", new BsonDocument()),
            new ServerAddress(), Set.of());
        when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenThrow(duplicate);

        assertThatThrownBy(() -> repository.incrementAndGet("agency-a", "KN", "2026"))
            .isSameAs(duplicate);
        verify(counters, times(2)).findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class));
    }

    @Test
    @DisplayName("incrementAndGet should not retry other store failures")
    void incrementAndGet_shouldNotRetry_whenFailureIsNotDuplicateKey() {
        MongoSocketReadTimeoutException timeout = new MongoSocketReadTimeoutException(
            "Timed out", new ServerAddress(), new IOException("read timed out"));
        when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenThrow(timeout);

        assertThatThrownBy(() -> repository.incrementAndGet("agency-a", "KN", "2026"))
            .isSameAs(timeout);
        verify(counters, times(1)).findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class));
    }
}
