package io.github.kbadmin.access.security;

import io.github.kbadmin.access.model.EntityType;

/** Decides whether a principal may legally receive an explicit grant. */
public interface GrantValidator {

    /**
     * @throws io.github.kbadmin.access.store.ResourceNotFoundException if the target is unknown
     * @throws io.github.kbadmin.access.store.AccessDeniedException if the target is not eligible
     */
    void validateTarget(EntityType entityType, String entityId);
}
