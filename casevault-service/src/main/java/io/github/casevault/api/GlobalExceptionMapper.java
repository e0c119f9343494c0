package io.github.casevault.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.casevault.api.dto.ErrorResponse;
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
 * Global exception mapper that ensures all unhandled exceptions are logged with full stack traces
 * and returned as structured JSON error responses.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

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
        return json(
                Response.Status.BAD_REQUEST,
                new ErrorResponse(
                        "Validation failed", "validation_error", Map.of("violations", violations)));
    }

    private String extractFieldName(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @ServerExceptionMapper
    public Response handleMalformedJson(JsonProcessingException e) {
        LOG.debugf("Rejected malformed request body: %s", e.getOriginalMessage());
        return json(
                Response.Status.BAD_REQUEST,
                new ErrorResponse(
                        "Malformed request body",
                        "validation_error",
                        Map.of("message", String.valueOf(e.getOriginalMessage()))));
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        // For WebApplicationException (includes JAX-RS responses), preserve the original status
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        // A unique index rejected a concurrent duplicate insert.
        if (hasCause(e, org.hibernate.exception.ConstraintViolationException.class)) {
            LOG.infof("Unique constraint rejected a write: %s", e.getMessage());
            return json(
                    Response.Status.CONFLICT,
                    new ErrorResponse(
                            "Conflict",
                            "conflict",
                            Map.of("message", "The resource was modified concurrently")));
        }

        LOG.errorf(e, "Unhandled exception");
        return json(
                Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse(
                        "Internal server error",
                        "internal_error",
                        Map.of(
                                "message",
                                e.getMessage() != null ? e.getMessage() : e.getClass().getName())));
    }

    static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static Response json(Response.Status status, ErrorResponse body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
