package io.github.kbadmin.access.store;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionGrant;
import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decorator that wraps a PermissionStore with timing metrics. Operations are recorded with the
 * metric name "kb.access.store.operation" tagged by domain and operation.
 */
public class MeteredPermissionStore implements PermissionStore {

    static final String METRIC_NAME = "kb.access.store.operation";

    private final MeterRegistry registry;
    private final ResourceDomain domain;
    private final PermissionStore delegate;

    public MeteredPermissionStore(
            MeterRegistry registry, ResourceDomain domain, PermissionStore delegate) {
        this.registry = registry;
        this.domain = domain;
        this.delegate = delegate;
    }

    @Override
    public PermissionLevel get(EntityType entityType, String entityId, String resourceId) {
        return timer("get").record(() -> delegate.get(entityType, entityId, resourceId));
    }

    @Override
    public PermissionLevel maxLevel(
            EntityType entityType, Collection<String> entityIds, String resourceId) {
        return timer("maxLevel")
                .record(() -> delegate.maxLevel(entityType, entityIds, resourceId));
    }

    @Override
    public Optional<PermissionLevel> upsert(
            EntityType entityType,
            String entityId,
            String resourceId,
            PermissionLevel level,
            String actorId) {
        return timer("upsert")
                .record(() -> delegate.upsert(entityType, entityId, resourceId, level, actorId));
    }

    @Override
    public List<PermissionGrant> listForResource(String resourceId) {
        return timer("listForResource").record(() -> delegate.listForResource(resourceId));
    }

    @Override
    public List<PermissionGrant> listAll() {
        return timer("listAll").record(delegate::listAll);
    }

    @Override
    public Set<String> listAccessibleResourceIds(String userId, Collection<String> teamIds) {
        return timer("listAccessibleResourceIds")
                .record(() -> delegate.listAccessibleResourceIds(userId, teamIds));
    }

    private Timer timer(String operation) {
        return registry.timer(METRIC_NAME, "domain", domain.toValue(), "operation", operation);
    }
}
