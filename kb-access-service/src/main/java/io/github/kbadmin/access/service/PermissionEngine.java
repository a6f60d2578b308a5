package io.github.kbadmin.access.service;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionGrant;
import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import io.github.kbadmin.access.security.Actor;
import io.github.kbadmin.access.security.AuditEntry;
import io.github.kbadmin.access.security.AuditRecorder;
import io.github.kbadmin.access.security.GrantValidator;
import io.github.kbadmin.access.security.TeamMembershipProvider;
import io.github.kbadmin.access.security.UserAccount;
import io.github.kbadmin.access.security.UserDirectory;
import io.github.kbadmin.access.store.AccessDeniedException;
import io.github.kbadmin.access.store.InvalidRequestException;
import io.github.kbadmin.access.store.PermissionStore;
import io.github.kbadmin.access.store.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Permission resolution and grant management for one resource domain.
 *
 * <p>A user's effective level on a resource is the highest of:
 *
 * <ul>
 *   <li>FULL, if the user is an administrator (no grants are consulted)
 *   <li>the user's direct grant
 *   <li>the grants of every team the user leads
 *   <li>the domain's configured default level
 * </ul>
 *
 * Plain team membership confers nothing.
 */
public class PermissionEngine {

    private static final Logger LOG = Logger.getLogger(PermissionEngine.class);

    private final DomainSettings settings;
    private final PermissionStore store;
    private final UserDirectory users;
    private final TeamMembershipProvider teams;
    private final GrantValidator grantValidator;
    private final AuditRecorder auditRecorder;

    public PermissionEngine(
            DomainSettings settings,
            PermissionStore store,
            UserDirectory users,
            TeamMembershipProvider teams,
            GrantValidator grantValidator,
            AuditRecorder auditRecorder) {
        this.settings = settings;
        this.store = store;
        this.users = users;
        this.teams = teams;
        this.grantValidator = grantValidator;
        this.auditRecorder = auditRecorder;
    }

    public ResourceDomain domain() {
        return settings.domain();
    }

    public PermissionLevel defaultLevel() {
        return settings.defaultLevel();
    }

    public PermissionLevel resolveUserPermission(String userId, String resourceId) {
        requireText(userId, "userId");
        String resource = domain().normalizeResourceId(resourceId);

        Optional<UserAccount> user = users.findUser(userId);
        if (user.isPresent() && user.get().isAdmin()) {
            return PermissionLevel.FULL;
        }

        PermissionLevel direct = store.get(EntityType.USER, userId, resource);
        List<String> leaderTeams = teams.leaderTeamIds(userId);
        PermissionLevel inherited = store.maxLevel(EntityType.TEAM, leaderTeams, resource);

        PermissionLevel effective =
                PermissionLevel.max(PermissionLevel.max(direct, inherited), defaultLevel());
        LOG.debugf(
                "Resolved %s permission user=%s resource=%s direct=%s inherited=%s effective=%s",
                domain().toValue(), userId, resource, direct, inherited, effective);
        return effective;
    }

    public boolean hasAtLeast(String userId, String resourceId, PermissionLevel required) {
        return resolveUserPermission(userId, resourceId).isAtLeast(required);
    }

    public void requireAtLeast(String userId, String resourceId, PermissionLevel required) {
        if (!hasAtLeast(userId, resourceId, required)) {
            throw new AccessDeniedException(
                    required.name() + " access to " + domain().toValue() + " required");
        }
    }

    public List<PermissionGrant> listGrants(String resourceId) {
        return store.listForResource(domain().normalizeResourceId(resourceId));
    }

    public List<PermissionGrant> listAllGrants() {
        return store.listAll();
    }

    /**
     * Resources the user may see listed: everything for administrators, otherwise those granted
     * to the user or to any team the user belongs to.
     *
     * @throws InvalidRequestException for singleton domains
     */
    public AccessibleResources accessibleResourceIds(String userId) {
        if (!domain().isEnumerable()) {
            throw new InvalidRequestException(
                    domain().toValue() + " resources cannot be enumerated");
        }
        requireText(userId, "userId");
        Optional<UserAccount> user = users.findUser(userId);
        if (user.isPresent() && user.get().isAdmin()) {
            return AccessibleResources.all();
        }
        return new AccessibleResources(
                false, store.listAccessibleResourceIds(userId, teams.teamIds(userId)));
    }

    /**
     * Creates or replaces a grant. Revocation is a grant of {@link PermissionLevel#NONE}.
     *
     * @param actor the user making the change, or {@code null} for system writes, which are not
     *     audited
     */
    public void setPermission(
            EntityType entityType,
            String entityId,
            String resourceId,
            PermissionLevel level,
            Actor actor) {
        if (entityType == null) {
            throw new InvalidRequestException("Entity type is required");
        }
        if (level == null) {
            throw new InvalidRequestException("Permission level is required");
        }
        requireText(entityId, "entityId");
        String resource = domain().normalizeResourceId(resourceId);

        grantValidator.validateTarget(entityType, entityId);

        String actorId = actor == null ? null : actor.id();
        Optional<PermissionLevel> previous =
                store.upsert(entityType, entityId, resource, level, actorId);
        LOG.infof(
                "Set %s permission %s:%s on %s to %s (was %s)",
                domain().toValue(),
                entityType.toValue(),
                entityId,
                resource,
                level,
                previous.map(Enum::name).orElse("unset"));

        audit(entityType, entityId, resource, level, previous, actor);
    }

    /**
     * Applies several grants on one resource. Items are validated up front; eligibility failures
     * are reported per item and do not stop the remaining items.
     */
    public List<GrantResult> setPermissions(
            String resourceId, List<GrantRequest> requests, Actor actor) {
        if (requests == null) {
            throw new InvalidRequestException("permissions must be a list");
        }
        for (GrantRequest request : requests) {
            if (request == null || request.entityType() == null || request.level() == null) {
                throw new InvalidRequestException(
                        "Each permission needs an entityType, entityId and level");
            }
            requireText(request.entityId(), "entityId");
        }
        String resource = domain().normalizeResourceId(resourceId);

        List<GrantResult> results = new ArrayList<>(requests.size());
        for (GrantRequest request : requests) {
            try {
                setPermission(
                        request.entityType(), request.entityId(), resource, request.level(), actor);
                results.add(GrantResult.ok(request));
            } catch (ResourceNotFoundException e) {
                results.add(GrantResult.failed(request, "not_found"));
            } catch (AccessDeniedException e) {
                results.add(GrantResult.failed(request, "forbidden"));
            }
        }
        return results;
    }

    private void audit(
            EntityType entityType,
            String entityId,
            String resourceId,
            PermissionLevel level,
            Optional<PermissionLevel> previous,
            Actor actor) {
        if (actor == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("domain", domain().toValue());
        details.put("entityType", entityType.toValue());
        details.put("entityId", entityId);
        details.put("resourceId", resourceId);
        details.put("level", level.value());
        details.put("previousLevel", previous.map(PermissionLevel::value).orElse(null));

        AuditEntry entry =
                new AuditEntry(
                        actor.id(),
                        actor.email(),
                        AuditEntry.ACTION_SET_PERMISSION,
                        domain().auditResourceType(),
                        entityType.toValue() + ":" + entityId + ":" + resourceId,
                        details,
                        actor.ipAddress());
        try {
            auditRecorder.log(entry);
        } catch (RuntimeException e) {
            // Best-effort: the grant is already committed.
            LOG.errorf(e, "Failed to record audit entry for %s", entry.resourceId());
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
    }
}
