package io.github.kbadmin.access.api;

import io.github.kbadmin.access.api.dto.ErrorResponse;
import io.github.kbadmin.access.store.AccessDeniedException;
import io.github.kbadmin.access.store.InvalidRequestException;
import io.github.kbadmin.access.store.PermissionStoreException;
import io.github.kbadmin.access.store.ResourceNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps domain exceptions to HTTP statuses with a structured JSON body. Anything unexpected is
 * logged with its stack trace and returned as a 500.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleInvalidRequest(InvalidRequestException e) {
        LOG.debugf("Rejected request: %s", e.getMessage());
        return error(
                Response.Status.BAD_REQUEST,
                "Bad request",
                "bad_request",
                Map.of("message", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response handleNotFound(ResourceNotFoundException e) {
        return error(
                Response.Status.NOT_FOUND,
                "Not found",
                "not_found",
                Map.of("resource", e.getResource(), "id", e.getId()));
    }

    @ServerExceptionMapper
    public Response handleAccessDenied(AccessDeniedException e) {
        LOG.infof("Access denied: %s", e.getMessage());
        return error(
                Response.Status.FORBIDDEN,
                "Forbidden",
                "forbidden",
                Map.of("message", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response handleStoreFailure(PermissionStoreException e) {
        LOG.errorf(e, "Permission store failure");
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                "Internal server error",
                "internal_error",
                Map.of("message", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response handleConstraintViolation(ConstraintViolationException e) {
        List<Map<String, String>> violations =
                e.getConstraintViolations().stream()
                        .map(
                                v ->
                                        Map.of(
                                                "field", extractFieldName(v),
                                                "message", v.getMessage()))
                        .toList();
        return error(
                Response.Status.BAD_REQUEST,
                "Validation failed",
                "validation_error",
                Map.of("violations", violations));
    }

    private String extractFieldName(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        // Preserve JAX-RS responses, including 401 from the security layer
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                "Internal server error",
                "internal_error",
                Map.of(
                        "message",
                        e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
    }

    private static Response error(
            Response.Status status, String error, String code, Map<String, Object> details) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(error, code, details))
                .build();
    }
}
