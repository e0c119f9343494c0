package io.github.casevault.api;

import io.github.casevault.api.dto.UserDto;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.security.RequestGuard;
import io.github.casevault.service.UserService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;

@Path("/v1/lawyers")
@Produces(MediaType.APPLICATION_JSON)
public class LawyersResource {

    @Inject RequestGuard guard;

    @Inject UserService userService;

    /** Active lawyers, for owners picking whom to grant access to. */
    @GET
    @Path("/available")
    public Response listAvailable(@Context HttpHeaders headers) {
        GuardDecision decision = guard.requireAuth(Credentials.fromHeaders(headers));
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        List<UserDto> lawyers =
                userService.listAvailableLawyers().stream().map(UserService::toDto).toList();
        return Response.ok(Map.of("data", lawyers)).build();
    }
}
