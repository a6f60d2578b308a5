package io.github.kbadmin.access.persistence.repo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionGrant;
import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class PermissionGrantRepositoryTest {

    private EntityManager entityManager;
    private Query query;
    private PermissionGrantRepository repository;

    @BeforeEach
    void setUp() {
        entityManager = mock(EntityManager.class);
        query = mock(Query.class);
        when(entityManager.createNativeQuery(anyString())).thenReturn(query);
        when(query.setParameter(anyString(), any()))
                .thenReturn(query);
        repository = new PermissionGrantRepository();
        repository.entityManager = entityManager;
    }

    private String capturedSql() {
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(entityManager).createNativeQuery(sql.capture());
        return sql.getValue();
    }

    @Test
    void upsert_is_a_single_on_conflict_statement() {
        List<Object> rows = new ArrayList<>();
        rows.add(null);
        when(query.getResultList()).thenReturn(rows);

        Optional<PermissionLevel> previous =
                repository.upsert(
                        ResourceDomain.PROMPT,
                        EntityType.USER,
                        "u1",
                        "library",
                        PermissionLevel.UPLOAD,
                        "admin");

        assertTrue(previous.isEmpty());
        String sql = capturedSql();
        assertTrue(sql.contains("INSERT INTO prompt_permissions"));
        assertTrue(
                sql.contains("ON CONFLICT (entity_type, entity_id, resource_id) DO UPDATE"));
        assertTrue(sql.contains("RETURNING"));
        verify(query).setParameter("level", 2);
        verify(query).setParameter("entityType", "user");
        verify(query).setParameter("actorId", "admin");
    }

    @Test
    void upsert_reports_previous_level_on_update() {
        when(query.getResultList()).thenReturn(List.of(1));

        Optional<PermissionLevel> previous =
                repository.upsert(
                        ResourceDomain.BUCKET,
                        EntityType.TEAM,
                        "t1",
                        "b1",
                        PermissionLevel.FULL,
                        null);

        assertEquals(Optional.of(PermissionLevel.VIEW), previous);
        assertTrue(capturedSql().contains("ON CONFLICT (entity_type, entity_id, bucket_id)"));
    }

    @Test
    void max_level_queries_all_teams_at_once() {
        when(query.getResultList()).thenReturn(List.of(2));

        Optional<PermissionLevel> max =
                repository.findMaxLevel(
                        ResourceDomain.BUCKET, EntityType.TEAM, Set.of("t1", "t2"), "b1");

        assertEquals(Optional.of(PermissionLevel.UPLOAD), max);
        String sql = capturedSql();
        assertTrue(sql.startsWith("SELECT MAX(permission_level) FROM document_permissions"));
        assertTrue(sql.contains("entity_id IN (:entityIds)"));
    }

    @Test
    void max_level_is_empty_when_no_team_has_a_grant() {
        when(query.getResultList()).thenReturn(Collections.singletonList(null));

        assertTrue(
                repository
                        .findMaxLevel(
                                ResourceDomain.STORAGE, EntityType.TEAM, List.of("t1"), "global")
                        .isEmpty());
    }

    @Test
    void accessible_ids_omit_team_clause_without_teams() {
        when(query.getResultList()).thenReturn(List.of("b1", "b2"));

        Set<String> ids =
                repository.findAccessibleResourceIds(ResourceDomain.BUCKET, "u1", List.of());

        assertEquals(Set.of("b1", "b2"), ids);
        String sql = capturedSql();
        assertTrue(sql.contains("permission_level > 0"));
        assertFalse(sql.contains(":teamIds"));
        verify(query, never()).setParameter(eq("teamIds"), any());
    }

    @Test
    void accessible_ids_include_team_grants() {
        when(query.getResultList()).thenReturn(List.of("b1"));

        repository.findAccessibleResourceIds(ResourceDomain.BUCKET, "u1", List.of("t1"));

        assertTrue(capturedSql().contains("entity_type = 'team' AND entity_id IN (:teamIds)"));
        verify(query).setParameter("teamIds", List.of("t1"));
    }

    @Test
    void maps_grant_rows() {
        Timestamp created = Timestamp.from(Instant.parse("2024-05-01T10:00:00Z"));
        List<Object[]> rows = new ArrayList<>();
        rows.add(new Object[] {"team", "t1", "b1", 3, created, created, "admin", null});
        when(query.getResultList()).thenReturn(rows);

        List<PermissionGrant> grants = repository.listForResource(ResourceDomain.BUCKET, "b1");

        assertEquals(1, grants.size());
        PermissionGrant grant = grants.get(0);
        assertEquals(EntityType.TEAM, grant.entityType());
        assertEquals(PermissionLevel.FULL, grant.level());
        assertEquals(
                OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC), grant.createdAt());
        assertEquals("admin", grant.createdBy());
        assertTrue(capturedSql().endsWith("ORDER BY entity_type, entity_id"));
    }
}
