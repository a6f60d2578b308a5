package io.github.kbadmin.access.security;

import java.util.Map;

/** One audit record of a mutation. {@code resourceId} is the compound grant key. */
public record AuditEntry(
        String userId,
        String userEmail,
        String action,
        String resourceType,
        String resourceId,
        Map<String, Object> details,
        String ipAddress) {

    public static final String ACTION_SET_PERMISSION = "set_permission";
}
