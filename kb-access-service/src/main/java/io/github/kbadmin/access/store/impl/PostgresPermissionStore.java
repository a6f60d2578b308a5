package io.github.kbadmin.access.store.impl;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionGrant;
import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import io.github.kbadmin.access.persistence.repo.PermissionGrantRepository;
import io.github.kbadmin.access.store.PermissionStore;
import io.github.kbadmin.access.store.PermissionStoreException;
import jakarta.persistence.PersistenceException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/** PermissionStore bound to one domain's grant table. */
public class PostgresPermissionStore implements PermissionStore {

    private static final Logger LOG = Logger.getLogger(PostgresPermissionStore.class);

    private final PermissionGrantRepository repository;
    private final ResourceDomain domain;

    public PostgresPermissionStore(PermissionGrantRepository repository, ResourceDomain domain) {
        this.repository = repository;
        this.domain = domain;
    }

    @Override
    public PermissionLevel get(EntityType entityType, String entityId, String resourceId) {
        return execute(
                "get",
                () ->
                        repository
                                .findLevel(domain, entityType, entityId, resourceId)
                                .orElse(PermissionLevel.NONE));
    }

    @Override
    public PermissionLevel maxLevel(
            EntityType entityType, Collection<String> entityIds, String resourceId) {
        if (entityIds == null || entityIds.isEmpty()) {
            return PermissionLevel.NONE;
        }
        return execute(
                "maxLevel",
                () ->
                        repository
                                .findMaxLevel(domain, entityType, entityIds, resourceId)
                                .orElse(PermissionLevel.NONE));
    }

    @Override
    public Optional<PermissionLevel> upsert(
            EntityType entityType,
            String entityId,
            String resourceId,
            PermissionLevel level,
            String actorId) {
        return execute(
                "upsert",
                () -> repository.upsert(domain, entityType, entityId, resourceId, level, actorId));
    }

    @Override
    public List<PermissionGrant> listForResource(String resourceId) {
        return execute("listForResource", () -> repository.listForResource(domain, resourceId));
    }

    @Override
    public List<PermissionGrant> listAll() {
        return execute("listAll", () -> repository.listAll(domain));
    }

    @Override
    public Set<String> listAccessibleResourceIds(String userId, Collection<String> teamIds) {
        return execute(
                "listAccessibleResourceIds",
                () -> repository.findAccessibleResourceIds(domain, userId, teamIds));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (PersistenceException e) {
            LOG.errorf(e, "Permission store %s failed on %s", operation, domain.table());
            throw new PermissionStoreException(
                    "Failed to " + operation + " permissions in " + domain.table(), e);
        }
    }
}
