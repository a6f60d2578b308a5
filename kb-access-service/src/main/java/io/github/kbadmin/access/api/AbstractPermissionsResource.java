package io.github.kbadmin.access.api;

import io.github.kbadmin.access.api.dto.BatchSetPermissionsRequest;
import io.github.kbadmin.access.api.dto.SetPermissionRequest;
import io.github.kbadmin.access.config.PermissionEngineRegistry;
import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionGrant;
import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import io.github.kbadmin.access.persistence.repo.UserRepository;
import io.github.kbadmin.access.security.Actor;
import io.github.kbadmin.access.security.UserAccount;
import io.github.kbadmin.access.service.GrantRequest;
import io.github.kbadmin.access.service.GrantResult;
import io.github.kbadmin.access.service.PermissionEngine;
import io.github.kbadmin.access.store.InvalidRequestException;
import io.quarkus.security.identity.SecurityIdentity;
import io.vertx.ext.web.RoutingContext;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grant management endpoints shared by every resource domain. Subclasses bind a path and a
 * {@link ResourceDomain}.
 *
 * <p>Any authenticated user may list and change grants; eligibility of the grant target is
 * enforced by the engine. Resolution always answers for the calling user.
 */
public abstract class AbstractPermissionsResource {

    @Inject PermissionEngineRegistry engineRegistry;

    @Inject UserRepository userRepository;

    @Inject SecurityIdentity identity;

    @Context HttpHeaders httpHeaders;

    @Context RoutingContext routingContext;

    protected abstract ResourceDomain domain();

    protected PermissionEngine engine() {
        return engineRegistry.forDomain(domain());
    }

    protected String currentUserId() {
        return identity.getPrincipal().getName();
    }

    @GET
    public Response listPermissions(@QueryParam("resourceId") String resourceId) {
        boolean unfiltered = resourceId == null || resourceId.isBlank();
        List<PermissionGrant> grants =
                unfiltered && domain().isEnumerable()
                        ? engine().listAllGrants()
                        : engine().listGrants(resourceId);
        return Response.ok(grants).build();
    }

    @POST
    public Response setPermission(@NotNull @Valid SetPermissionRequest request) {
        GrantRequest grant = toGrantRequest(request);
        engine().setPermission(
                grant.entityType(),
                grant.entityId(),
                request.getResourceId(),
                grant.level(),
                currentActor());
        return Response.ok(Map.of("success", true)).build();
    }

    @POST
    @Path("/batch")
    public Response setPermissions(@NotNull @Valid BatchSetPermissionsRequest request) {
        List<GrantRequest> grants =
                request.getPermissions().stream()
                        .map(AbstractPermissionsResource::toGrantRequest)
                        .toList();
        List<GrantResult> results =
                engine().setPermissions(request.getResourceId(), grants, currentActor());
        return Response.ok(Map.of("results", results)).build();
    }

    @GET
    @Path("/resolve")
    public Response resolve(@QueryParam("resourceId") String resourceId) {
        PermissionLevel level = engine().resolveUserPermission(currentUserId(), resourceId);
        return Response.ok(Map.of("level", level)).build();
    }

    @GET
    @Path("/check")
    public Response check(
            @QueryParam("resourceId") String resourceId, @QueryParam("level") String level) {
        PermissionLevel required = PermissionLevel.parse(level);
        PermissionLevel effective = engine().resolveUserPermission(currentUserId(), resourceId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("allowed", effective.isAtLeast(required));
        body.put("level", effective);
        return Response.ok(body).build();
    }

    protected Actor currentActor() {
        String userId = currentUserId();
        String email = userRepository.findUser(userId).map(UserAccount::email).orElse(null);
        return new Actor(userId, email, clientIp());
    }

    String clientIp() {
        if (httpHeaders != null) {
            String forwarded = httpHeaders.getHeaderString("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        if (routingContext != null && routingContext.request().remoteAddress() != null) {
            return routingContext.request().remoteAddress().host();
        }
        return null;
    }

    static GrantRequest toGrantRequest(SetPermissionRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Permission entry is required");
        }
        if (request.getEntityType() == null || request.getLevel() == null) {
            throw new InvalidRequestException("entityType and level are required");
        }
        return new GrantRequest(
                EntityType.parse(request.getEntityType()),
                request.getEntityId(),
                PermissionLevel.parse(request.getLevel()));
    }
}
