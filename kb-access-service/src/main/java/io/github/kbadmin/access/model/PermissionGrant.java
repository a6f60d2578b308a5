package io.github.kbadmin.access.model;

import java.time.OffsetDateTime;

/** One explicit (entity, resource) grant as persisted. */
public record PermissionGrant(
        EntityType entityType,
        String entityId,
        String resourceId,
        PermissionLevel level,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        String createdBy,
        String updatedBy) {}
