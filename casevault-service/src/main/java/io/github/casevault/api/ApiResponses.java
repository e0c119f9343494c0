package io.github.casevault.api;

import io.github.casevault.api.dto.ErrorResponse;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.service.AccessRequestException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Error bodies shared by the resources. */
final class ApiResponses {

    private ApiResponses() {}

    /** Response for a guard decision that is not ALLOWED. */
    static Response denied(GuardDecision decision) {
        if (decision.getOutcome() == GuardDecision.Outcome.UNAUTHENTICATED) {
            return unauthenticated("Authentication required");
        }
        return forbidden("Not allowed");
    }

    static Response unauthenticated(String message) {
        return error(
                Response.Status.UNAUTHORIZED,
                "Unauthorized",
                "unauthenticated",
                Map.of("message", message));
    }

    static Response forbidden(String message) {
        return error(
                Response.Status.FORBIDDEN, "Forbidden", "forbidden", Map.of("message", message));
    }

    static Response notFound(String resource, String id) {
        return error(
                Response.Status.NOT_FOUND,
                "Not found",
                "not_found",
                Map.of("resource", resource, "id", String.valueOf(id)));
    }

    static Response conflict(String message) {
        return error(Response.Status.CONFLICT, "Conflict", "conflict", Map.of("message", message));
    }

    static Response badRequest(String message) {
        return error(
                Response.Status.BAD_REQUEST,
                "Bad request",
                "validation_error",
                Map.of("message", message));
    }

    static Response fromAccessRequestException(AccessRequestException e) {
        Map<String, Object> details = new HashMap<>();
        details.put("reason", e.getReason().name());
        details.put("message", e.getMessage());
        if (e.getGrantOutcome() != null) {
            details.put("grantOutcome", e.getGrantOutcome().name());
        }
        return switch (e.getReason()) {
            case NOT_A_LAWYER, NOT_REVIEWER -> error(
                    Response.Status.FORBIDDEN, "Forbidden", "forbidden", details);
            // Same body as a guard denial.
            case CASE_NOT_FOUND -> forbidden("Not allowed");
            case REQUEST_NOT_FOUND, NO_PENDING_REQUEST -> error(
                    Response.Status.NOT_FOUND, "Not found", "not_found", details);
            case ALREADY_GRANTED, DUPLICATE_PENDING, RESUBMIT_COOLDOWN, ALREADY_REVIEWED -> error(
                    Response.Status.CONFLICT, "Conflict", "conflict", details);
            case GRANT_FAILED -> error(
                    Response.Status.BAD_REQUEST, "Bad request", "validation_error", details);
        };
    }

    static Optional<UUID> parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static Response error(
            Response.Status status, String error, String code, Map<String, Object> details) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(error, code, details))
                .build();
    }
}
