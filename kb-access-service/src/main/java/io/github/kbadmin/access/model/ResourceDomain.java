package io.github.kbadmin.access.model;

import io.github.kbadmin.access.store.InvalidRequestException;

/**
 * A protected resource namespace. Each domain keeps its grants in its own table; singleton
 * domains have exactly one resource, addressed by a fixed sentinel id.
 */
public enum ResourceDomain {
    BUCKET("document_permissions", "bucket_id", null, "permission", true),
    STORAGE("storage_permissions", "resource_id", "global", "permission", false),
    PROMPT("prompt_permissions", "resource_id", "library", "prompt", false);

    private final String table;
    private final String resourceColumn;
    private final String sentinelResourceId;
    private final String auditResourceType;
    private final boolean enumerable;

    ResourceDomain(
            String table,
            String resourceColumn,
            String sentinelResourceId,
            String auditResourceType,
            boolean enumerable) {
        this.table = table;
        this.resourceColumn = resourceColumn;
        this.sentinelResourceId = sentinelResourceId;
        this.auditResourceType = auditResourceType;
        this.enumerable = enumerable;
    }

    public String table() {
        return table;
    }

    public String resourceColumn() {
        return resourceColumn;
    }

    public String auditResourceType() {
        return auditResourceType;
    }

    public boolean isEnumerable() {
        return enumerable;
    }

    public String toValue() {
        return name().toLowerCase();
    }

    /**
     * Maps a caller supplied resource id into this domain's namespace. The storage tier ignores
     * the supplied id, the prompt library falls back to its sentinel, and buckets require one.
     */
    public String normalizeResourceId(String resourceId) {
        if (this == STORAGE) {
            return sentinelResourceId;
        }
        if (resourceId == null || resourceId.isBlank()) {
            if (sentinelResourceId != null) {
                return sentinelResourceId;
            }
            throw new InvalidRequestException("resourceId is required");
        }
        return resourceId.trim();
    }
}
