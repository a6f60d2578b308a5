package io.github.kbadmin.access.store;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionGrant;
import io.github.kbadmin.access.model.PermissionLevel;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence of explicit grants for a single resource domain. At most one grant exists per
 * (entity type, entity id, resource id).
 */
public interface PermissionStore {

    /** Returns the stored level, or {@link PermissionLevel#NONE} when there is no grant. */
    PermissionLevel get(EntityType entityType, String entityId, String resourceId);

    /**
     * Returns the highest level granted to any of the given entities on the resource, in a
     * single lookup. An empty collection yields {@link PermissionLevel#NONE}.
     */
    PermissionLevel maxLevel(
            EntityType entityType, Collection<String> entityIds, String resourceId);

    /**
     * Creates or updates the grant in one atomic operation.
     *
     * @param actorId the user performing the change, {@code null} for system writes
     * @return the level held before this call, or empty if the grant was created
     */
    Optional<PermissionLevel> upsert(
            EntityType entityType,
            String entityId,
            String resourceId,
            PermissionLevel level,
            String actorId);

    List<PermissionGrant> listForResource(String resourceId);

    List<PermissionGrant> listAll();

    /**
     * Resource ids on which the user, or any of the supplied teams, holds a grant above {@link
     * PermissionLevel#NONE}.
     */
    Set<String> listAccessibleResourceIds(String userId, Collection<String> teamIds);
}
