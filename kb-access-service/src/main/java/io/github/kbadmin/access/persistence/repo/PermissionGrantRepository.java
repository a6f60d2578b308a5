package io.github.kbadmin.access.persistence.repo;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionGrant;
import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Native SQL access to the per-domain grant tables. Table and column names come from {@link
 * ResourceDomain} constants, never from request input.
 */
@ApplicationScoped
public class PermissionGrantRepository {

    @Inject EntityManager entityManager;

    @Transactional
    public Optional<PermissionLevel> findLevel(
            ResourceDomain domain, EntityType entityType, String entityId, String resourceId) {
        String sql =
                "SELECT permission_level FROM "
                        + domain.table()
                        + " WHERE entity_type = :entityType AND entity_id = :entityId AND "
                        + domain.resourceColumn()
                        + " = :resourceId";
        List<?> rows =
                entityManager
                        .createNativeQuery(sql)
                        .setParameter("entityType", entityType.toValue())
                        .setParameter("entityId", entityId)
                        .setParameter("resourceId", resourceId)
                        .getResultList();
        return rows.stream().findFirst().map(PermissionGrantRepository::toLevel);
    }

    /** Highest level held by any of the entities, computed in one query. */
    @Transactional
    public Optional<PermissionLevel> findMaxLevel(
            ResourceDomain domain,
            EntityType entityType,
            Collection<String> entityIds,
            String resourceId) {
        String sql =
                "SELECT MAX(permission_level) FROM "
                        + domain.table()
                        + " WHERE entity_type = :entityType AND entity_id IN (:entityIds) AND "
                        + domain.resourceColumn()
                        + " = :resourceId";
        List<?> rows =
                entityManager
                        .createNativeQuery(sql)
                        .setParameter("entityType", entityType.toValue())
                        .setParameter("entityIds", List.copyOf(entityIds))
                        .setParameter("resourceId", resourceId)
                        .getResultList();
        return rows.stream()
                .filter(row -> row != null)
                .findFirst()
                .map(PermissionGrantRepository::toLevel);
    }

    /**
     * Inserts the grant or updates the existing one in a single statement keyed by the table's
     * (entity_type, entity_id, resource) unique constraint. The prior level is captured by the
     * same statement.
     *
     * @return the previous level, or empty if the row was created
     */
    @Transactional
    public Optional<PermissionLevel> upsert(
            ResourceDomain domain,
            EntityType entityType,
            String entityId,
            String resourceId,
            PermissionLevel level,
            String actorId) {
        String table = domain.table();
        String column = domain.resourceColumn();
        String sql =
                "WITH prior AS (SELECT permission_level FROM "
                        + table
                        + " WHERE entity_type = :entityType AND entity_id = :entityId AND "
                        + column
                        + " = :resourceId) INSERT INTO "
                        + table
                        + " (entity_type, entity_id, "
                        + column
                        + ", permission_level, created_by, updated_by) VALUES (:entityType,"
                        + " :entityId, :resourceId, :level, CAST(:actorId AS TEXT), CAST(:actorId"
                        + " AS TEXT)) ON CONFLICT (entity_type, entity_id, "
                        + column
                        + ") DO UPDATE SET permission_level = EXCLUDED.permission_level,"
                        + " updated_by = EXCLUDED.updated_by, updated_at = NOW()"
                        + " RETURNING (SELECT permission_level FROM prior)";
        List<?> rows =
                entityManager
                        .createNativeQuery(sql)
                        .setParameter("entityType", entityType.toValue())
                        .setParameter("entityId", entityId)
                        .setParameter("resourceId", resourceId)
                        .setParameter("level", level.value())
                        .setParameter("actorId", actorId)
                        .getResultList();
        return rows.stream()
                .filter(row -> row != null)
                .findFirst()
                .map(PermissionGrantRepository::toLevel);
    }

    @Transactional
    public List<PermissionGrant> listForResource(ResourceDomain domain, String resourceId) {
        String sql =
                selectGrants(domain)
                        + " WHERE "
                        + domain.resourceColumn()
                        + " = :resourceId ORDER BY entity_type, entity_id";
        @SuppressWarnings("unchecked")
        List<Object[]> rows =
                entityManager
                        .createNativeQuery(sql)
                        .setParameter("resourceId", resourceId)
                        .getResultList();
        return rows.stream().map(PermissionGrantRepository::toGrant).toList();
    }

    @Transactional
    public List<PermissionGrant> listAll(ResourceDomain domain) {
        String sql =
                selectGrants(domain)
                        + " ORDER BY "
                        + domain.resourceColumn()
                        + ", entity_type, entity_id";
        @SuppressWarnings("unchecked")
        List<Object[]> rows = entityManager.createNativeQuery(sql).getResultList();
        return rows.stream().map(PermissionGrantRepository::toGrant).toList();
    }

    /**
     * Distinct resource ids on which the user holds a direct grant, or any of the teams holds a
     * grant, above NONE.
     */
    @Transactional
    public Set<String> findAccessibleResourceIds(
            ResourceDomain domain, String userId, Collection<String> teamIds) {
        boolean withTeams = teamIds != null && !teamIds.isEmpty();
        StringBuilder sql =
                new StringBuilder("SELECT DISTINCT ")
                        .append(domain.resourceColumn())
                        .append(" FROM ")
                        .append(domain.table())
                        .append(" WHERE permission_level > 0 AND ((entity_type = 'user' AND")
                        .append(" entity_id = :userId)");
        if (withTeams) {
            sql.append(" OR (entity_type = 'team' AND entity_id IN (:teamIds))");
        }
        sql.append(")");

        var query = entityManager.createNativeQuery(sql.toString()).setParameter("userId", userId);
        if (withTeams) {
            query.setParameter("teamIds", List.copyOf(teamIds));
        }
        List<?> rows = query.getResultList();
        Set<String> result = new LinkedHashSet<>();
        for (Object row : rows) {
            result.add(row.toString());
        }
        return result;
    }

    private static String selectGrants(ResourceDomain domain) {
        return "SELECT entity_type, entity_id, "
                + domain.resourceColumn()
                + ", permission_level, created_at, updated_at, created_by, updated_by FROM "
                + domain.table();
    }

    private static PermissionGrant toGrant(Object[] row) {
        return new PermissionGrant(
                EntityType.parse((String) row[0]),
                (String) row[1],
                (String) row[2],
                toLevel(row[3]),
                toOffsetDateTime(row[4]),
                toOffsetDateTime(row[5]),
                (String) row[6],
                (String) row[7]);
    }

    static PermissionLevel toLevel(Object value) {
        return PermissionLevel.fromValue(((Number) value).intValue());
    }

    static OffsetDateTime toOffsetDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime;
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().atOffset(ZoneOffset.UTC);
        }
        return OffsetDateTime.parse(value.toString());
    }
}
