package tech.agencydesk.platform.tenant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.bson.Document;
import org.jboss.logging.Logger;
import tech.agencydesk.platform.config.PlatformConfig;
import tech.agencydesk.platform.scope.ScopedStoreFactory;
import tech.agencydesk.platform.shared.Instrumented;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of TenantConfigRepository.
 * Reads through the tenant scope, so an agency only ever sees its own configuration.
 * Package-private to prevent direct injection - use TenantConfigRepository interface.
 */
@ApplicationScoped
@Typed(TenantConfigRepository.class)
@Instrumented(collection = "agency_configs")
class MongoTenantConfigRepository implements TenantConfigRepository {

    private static final Logger LOG = Logger.getLogger(MongoTenantConfigRepository.class);

    @Inject
    ScopedStoreFactory storeFactory;

    @Inject
    PlatformConfig config;

    @Override
    public Optional<List<String>> findVerticalIds(String tenantId) {
        Document tenantConfig = storeFactory.forTenant(tenantId)
            .collection(config.tenantConfig().collection())
            .findOne(new Document());

        if (tenantConfig == null) {
            LOG.debugf("No configuration document for tenant %s", tenantId);
            return Optional.empty();
        }

        Object verticals = tenantConfig.get("verticals");
        if (!(verticals instanceof List<?> entries)) {
            return Optional.empty();
        }

        List<String> ids = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Document vertical) {
                Object id = vertical.get("id");
                if (id != null) {
                    ids.add(id.toString());
                }
            } else if (entry instanceof String id) {
                ids.add(id);
            }
        }
        return Optional.of(ids);
    }
}
