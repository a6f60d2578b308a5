package io.github.kbadmin.access.service;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionLevel;

/** One parsed item of a batch grant. */
public record GrantRequest(EntityType entityType, String entityId, PermissionLevel level) {}
