package io.github.casevault.api;

import io.github.casevault.api.dto.UpdateUserRequest;
import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.entity.UserEntity;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.security.RequestGuard;
import io.github.casevault.service.UserService;
import io.github.casevault.store.ResourceNotFoundException;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

@Path("/v1/admin/users")
@Produces(MediaType.APPLICATION_JSON)
public class AdminUsersResource {

    private static final Logger LOG = Logger.getLogger(AdminUsersResource.class);

    @Inject RequestGuard guard;

    @Inject UserService userService;

    @GET
    @Path("/{userId}")
    public Response getUser(@Context HttpHeaders headers, @PathParam("userId") String userId) {
        GuardDecision decision =
                guard.requireRole(Credentials.fromHeaders(headers), UserRole.ADMIN);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        return ApiResponses.parseUuid(userId)
                .flatMap(userService::findById)
                .map(user -> Response.ok(UserService.toDto(user)).build())
                .orElseGet(() -> ApiResponses.notFound("user", userId));
    }

    /** Soft delete and restore. Deactivation ends every session of the user. */
    @PATCH
    @Path("/{userId}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response updateUser(
            @Context HttpHeaders headers,
            @PathParam("userId") String userId,
            @NotNull @Valid UpdateUserRequest request) {
        GuardDecision decision =
                guard.requireRole(Credentials.fromHeaders(headers), UserRole.ADMIN);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        Optional<UUID> id = ApiResponses.parseUuid(userId);
        if (id.isEmpty()) {
            return ApiResponses.notFound("user", userId);
        }
        if (id.get().equals(decision.principal().id()) && !request.getActive()) {
            return ApiResponses.conflict("Administrators cannot deactivate themselves");
        }
        try {
            UserEntity user = userService.setActive(id.get(), request.getActive());
            LOG.infof(
                    "Administrator %s set user %s active=%b",
                    decision.principal().id(), id.get(), request.getActive());
            return Response.ok(UserService.toDto(user)).build();
        } catch (ResourceNotFoundException e) {
            return ApiResponses.notFound(e.getResource(), e.getId());
        }
    }
}
