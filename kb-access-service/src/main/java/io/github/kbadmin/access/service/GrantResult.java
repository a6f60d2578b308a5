package io.github.kbadmin.access.service;

import io.github.kbadmin.access.model.EntityType;

/** Outcome of one batch item; {@code error} is null on success. */
public record GrantResult(EntityType entityType, String entityId, boolean success, String error) {

    public static GrantResult ok(GrantRequest request) {
        return new GrantResult(request.entityType(), request.entityId(), true, null);
    }

    public static GrantResult failed(GrantRequest request, String error) {
        return new GrantResult(request.entityType(), request.entityId(), false, error);
    }
}
