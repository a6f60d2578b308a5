package io.github.kbadmin.access.api.dto;

/**
 * Body of a grant request. Fields are kept as raw strings so malformed values surface as a 400
 * from validation rather than a deserialization failure; {@code level} accepts {@code 2} or
 * {@code "upload"}.
 */
public class SetPermissionRequest {

    private String entityType;
    private String entityId;
    private String resourceId;
    private String level;

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }
}
