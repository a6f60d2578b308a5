package io.github.kbadmin.access.api;

import io.github.kbadmin.access.model.ResourceDomain;
import io.github.kbadmin.access.service.AccessibleResources;
import io.quarkus.security.Authenticated;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/v1/buckets/permissions")
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BucketPermissionsResource extends AbstractPermissionsResource {

    @Override
    protected ResourceDomain domain() {
        return ResourceDomain.BUCKET;
    }

    /** Buckets the caller may see listed, directly or through any team membership. */
    @GET
    @Path("/accessible")
    public Response accessible() {
        AccessibleResources accessible = engine().accessibleResourceIds(currentUserId());
        return Response.ok(accessible).build();
    }
}
