package tech.agencydesk.platform.shared;

import com.mongodb.MongoSocketWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.interceptor.InvocationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.agencydesk.platform.scope.ScopeFieldMapping;
import tech.agencydesk.platform.scope.ScopedStoreFactory;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InstrumentedInterceptorTest {

    @Instrumented(collection = "task_history")
    static class HistoryStore {
        public int append() {
            return 2;
        }
    }

    static class HistoryStore_Subclass extends HistoryStore {
    }

    @Instrumented(collection = "sequence_counters")
    static class CounterStore {
        public long increment() {
            return 1L;
        }
    }

    static class UnnamedStore {
        public void save() {
        }
    }

    @Mock
    private InvocationContext ctx;

    @Mock
    private MongoDatabase database;

    private SimpleMeterRegistry registry;
    private InstrumentedInterceptor interceptor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        interceptor = new InstrumentedInterceptor();
        interceptor.registry = registry;
        interceptor.storeFactory = new ScopedStoreFactory(database, ScopeFieldMapping.standard());
    }

    @Test
    @DisplayName("instrument should time legacy collections under their studio_id scope field")
    void instrument_shouldTagLegacyScopeField() throws Exception {
        when(ctx.getMethod()).thenReturn(HistoryStore.class.getMethod("append"));
        when(ctx.getTarget()).thenReturn(new HistoryStore_Subclass());
        when(ctx.proceed()).thenReturn(2);

        assertThat(interceptor.instrument(ctx)).isEqualTo(2);

        assertThat(registry.get("agencydesk.store.duration")
            .tag("collection", "task_history")
            .tag("scope_field", "studio_id")
            .tag("operation", "append")
            .tag("result", "success")
            .timer().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("instrument should count and rethrow store failures")
    void instrument_shouldRecordAndRethrowError() throws Exception {
        MongoSocketWriteException failure = new MongoSocketWriteException(
            "Exception sending message", new ServerAddress(), new IOException("broken pipe"));
        when(ctx.getMethod()).thenReturn(CounterStore.class.getMethod("increment"));
        when(ctx.getTarget()).thenReturn(new CounterStore());
        when(ctx.proceed()).thenThrow(failure);

        assertThatThrownBy(() -> interceptor.instrument(ctx)).isSameAs(failure);

        assertThat(registry.get("agencydesk.store.errors")
            .tag("collection", "sequence_counters")
            .tag("scope_field", "agency_id")
            .tag("error_type", "connection")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("agencydesk.store.duration").tag("result", "error").timer().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("resolveCollection should fall back to unknown when no collection is declared")
    void resolveCollection_shouldFallBack_whenNotDeclared() throws Exception {
        when(ctx.getMethod()).thenReturn(UnnamedStore.class.getMethod("save"));
        when(ctx.getTarget()).thenReturn(new UnnamedStore());

        assertThat(InstrumentedInterceptor.resolveCollection(ctx)).isEqualTo("unknown");
    }
}
