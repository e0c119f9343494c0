package io.github.casevault.api;

import io.github.casevault.api.dto.AccessRequestDto;
import io.github.casevault.api.dto.ReviewAccessRequest;
import io.github.casevault.model.UserRole;
import io.github.casevault.security.AuthorizationService;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.security.Principal;
import io.github.casevault.security.RequestGuard;
import io.github.casevault.service.AccessRequestException;
import io.github.casevault.service.AccessRequestService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Path("/v1/access-requests")
@Produces(MediaType.APPLICATION_JSON)
public class AccessRequestsResource {

    @Inject RequestGuard guard;

    @Inject AuthorizationService authorizationService;

    @Inject AccessRequestService accessRequestService;

    @GET
    @Path("/mine")
    public Response listMine(@Context HttpHeaders headers) {
        GuardDecision decision =
                guard.requireRole(Credentials.fromHeaders(headers), UserRole.LAWYER);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        return Response.ok(Map.of("data", accessRequestService.listForLawyer(decision.principal())))
                .build();
    }

    /** Visible to the requesting lawyer and to whoever may review it; 404 for everyone else. */
    @GET
    @Path("/{requestId}")
    public Response getRequest(
            @Context HttpHeaders headers, @PathParam("requestId") String requestId) {
        GuardDecision decision = guard.requireAuth(Credentials.fromHeaders(headers));
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        Principal principal = decision.principal();
        Optional<AccessRequestDto> request =
                ApiResponses.parseUuid(requestId).flatMap(accessRequestService::findById);
        if (request.isEmpty() || !isVisibleTo(request.get(), principal)) {
            return ApiResponses.notFound("access_request", requestId);
        }
        return Response.ok(request.get()).build();
    }

    @POST
    @Path("/{requestId}/review")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response review(
            @Context HttpHeaders headers,
            @PathParam("requestId") String requestId,
            @NotNull @Valid ReviewAccessRequest body) {
        GuardDecision decision = guard.requireAuth(Credentials.fromHeaders(headers));
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        Optional<UUID> id = ApiResponses.parseUuid(requestId);
        if (id.isEmpty()) {
            return ApiResponses.notFound("access_request", requestId);
        }
        try {
            AccessRequestDto reviewed =
                    accessRequestService.review(id.get(), decision.principal(), body.getDecision());
            return Response.ok(reviewed).build();
        } catch (AccessRequestException e) {
            return ApiResponses.fromAccessRequestException(e);
        }
    }

    private boolean isVisibleTo(AccessRequestDto request, Principal principal) {
        if (principal.id().toString().equals(request.getLawyerId())) {
            return true;
        }
        return authorizationService.isOwner(principal, UUID.fromString(request.getCaseId()));
    }
}
