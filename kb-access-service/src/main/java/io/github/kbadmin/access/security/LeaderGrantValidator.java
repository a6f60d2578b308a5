package io.github.kbadmin.access.security;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.store.AccessDeniedException;
import io.github.kbadmin.access.store.ResourceNotFoundException;

/**
 * Only team leaders may hold per-user grants. Administrators already have implicit full access
 * and ordinary users receive access through their team. Team targets are accepted unchecked.
 */
public class LeaderGrantValidator implements GrantValidator {

    private final UserDirectory users;

    public LeaderGrantValidator(UserDirectory users) {
        this.users = users;
    }

    @Override
    public void validateTarget(EntityType entityType, String entityId) {
        if (entityType != EntityType.USER) {
            return;
        }
        UserAccount target =
                users.findUser(entityId)
                        .orElseThrow(() -> new ResourceNotFoundException("user", entityId));
        if (!target.isLeader()) {
            throw new AccessDeniedException(
                    "Permissions can only be granted to users with the leader role");
        }
    }
}
