package tech.agencydesk.platform.shared;

import jakarta.enterprise.util.Nonbinding;
import jakarta.interceptor.InterceptorBinding;
import java.lang.annotation.*;

/**
 * Marks a repository class for automatic metrics instrumentation.
 *
 * Usage:
 * <pre>
 * {@code @Instrumented(collection = "task_history")}
 * class MongoAuditLogRepository implements AuditLogRepository { ... }
 * </pre>
 *
 * Metrics produced, tagged by collection, scope_field and operation:
 * - agencydesk.store.duration (timer, also tagged by result)
 * - agencydesk.store.errors (counter, also tagged by error_type)
 */
@Inherited
@InterceptorBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Instrumented {

    /**
     * Collection name used as the metric tag.
     * Also decides the scope_field tag. Repositories without one are tagged "unknown".
     */
    @Nonbinding
    String collection() default "";
}
