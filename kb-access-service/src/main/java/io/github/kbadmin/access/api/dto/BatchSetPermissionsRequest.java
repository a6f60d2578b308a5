package io.github.kbadmin.access.api.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;

public class BatchSetPermissionsRequest {

    private String resourceId;

    @NotNull(message = "permissions must be a list")
    private List<SetPermissionRequest> permissions;

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public List<SetPermissionRequest> getPermissions() {
        return permissions;
    }

    public void setPermissions(List<SetPermissionRequest> permissions) {
        this.permissions = permissions;
    }
}
