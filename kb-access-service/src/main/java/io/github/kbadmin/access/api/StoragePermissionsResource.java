package io.github.kbadmin.access.api;

import io.github.kbadmin.access.model.ResourceDomain;
import io.quarkus.security.Authenticated;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/v1/storage/permissions")
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StoragePermissionsResource extends AbstractPermissionsResource {

    @Override
    protected ResourceDomain domain() {
        return ResourceDomain.STORAGE;
    }
}
