package io.github.casevault.api;

import io.github.casevault.api.dto.AccessRequestDto;
import io.github.casevault.model.UserRole;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.security.RequestGuard;
import io.github.casevault.service.AccessRequestException;
import io.github.casevault.service.AccessRequestService;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
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

/** Access requests scoped to one case: lawyers submit and withdraw, owners list. */
@Path("/v1/cases/{caseId}/access-requests")
@Produces(MediaType.APPLICATION_JSON)
public class CaseAccessRequestsResource {

    @Inject RequestGuard guard;

    @Inject AccessRequestService accessRequestService;

    @POST
    public Response submit(@Context HttpHeaders headers, @PathParam("caseId") String caseId) {
        GuardDecision decision =
                guard.requireRole(Credentials.fromHeaders(headers), UserRole.LAWYER);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        Optional<UUID> id = ApiResponses.parseUuid(caseId);
        if (id.isEmpty()) {
            return ApiResponses.forbidden("Not allowed");
        }
        try {
            AccessRequestDto created = accessRequestService.submit(decision.principal(), id.get());
            return Response.status(Response.Status.CREATED).entity(created).build();
        } catch (AccessRequestException e) {
            return ApiResponses.fromAccessRequestException(e);
        }
    }

    @DELETE
    public Response withdraw(@Context HttpHeaders headers, @PathParam("caseId") String caseId) {
        GuardDecision decision =
                guard.requireRole(Credentials.fromHeaders(headers), UserRole.LAWYER);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        Optional<UUID> id = ApiResponses.parseUuid(caseId);
        if (id.isEmpty()) {
            return ApiResponses.notFound("access_request", caseId);
        }
        try {
            accessRequestService.withdraw(decision.principal(), id.get());
            return Response.noContent().build();
        } catch (AccessRequestException e) {
            return ApiResponses.fromAccessRequestException(e);
        }
    }

    @GET
    public Response listForCase(@Context HttpHeaders headers, @PathParam("caseId") String caseId) {
        GuardDecision decision =
                guard.requireCaseOwnership(Credentials.fromHeaders(headers), caseId);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        UUID id = UUID.fromString(caseId.trim());
        return Response.ok(Map.of("data", accessRequestService.listForCase(id))).build();
    }
}
