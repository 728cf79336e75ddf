package tech.agencydesk.platform.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.scope.ScopedStoreFactory;

/**
 * Times every call on an {@link Instrumented} repository.
 *
 * Meters are tagged with the collection and the field the collection is
 * scoped by, so legacy {@code studio_id} collections can be told apart from
 * {@code agency_id} ones. Tenant ids are never used as tags.
 */
@Instrumented
@Interceptor
@Priority(Interceptor.Priority.APPLICATION)
public class InstrumentedInterceptor {

    private static final Logger LOG = Logger.getLogger(InstrumentedInterceptor.class);

    static final String UNKNOWN_COLLECTION = "unknown";
    private static final long SLOW_OPERATION_THRESHOLD_MS = 100;

    @Inject
    MeterRegistry registry;

    @Inject
    ScopedStoreFactory storeFactory;

    @AroundInvoke
    public Object instrument(InvocationContext ctx) throws Exception {
        String collection = resolveCollection(ctx);
        Tags tags = Tags.of(
            "collection", collection,
            "scope_field", storeFactory.fieldMapping().fieldFor(collection),
            "operation", ctx.getMethod().getName());

        Timer.Sample sample = Timer.start(registry);
        String result = "success";
        try {
            return ctx.proceed();
        } catch (Exception e) {
            result = "error";
            registry.counter("agencydesk.store.errors", tags.and("error_type", MongoErrors.classify(e))).increment();
            throw e;
        } finally {
            long durationMs = sample.stop(registry.timer("agencydesk.store.duration", tags.and("result", result)))
                / 1_000_000;
            if (durationMs > SLOW_OPERATION_THRESHOLD_MS) {
                LOG.warnf("Slow store operation: %s.%s took %dms", collection, ctx.getMethod().getName(), durationMs);
            }
        }
    }

    /**
     * The collection named on the method, else on the repository class. CDI
     * subclasses inherit the class annotation.
     */
    static String resolveCollection(InvocationContext ctx) {
        Instrumented annotation = ctx.getMethod().getAnnotation(Instrumented.class);
        if (annotation == null || annotation.collection().isEmpty()) {
            annotation = ctx.getTarget().getClass().getAnnotation(Instrumented.class);
        }
        return annotation != null && !annotation.collection().isEmpty()
            ? annotation.collection()
            : UNKNOWN_COLLECTION;
    }
}
