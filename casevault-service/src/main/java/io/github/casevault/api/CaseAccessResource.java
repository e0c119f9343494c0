package io.github.casevault.api;

import io.github.casevault.api.dto.GrantAccessRequest;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.security.RequestGuard;
import io.github.casevault.service.CaseAccessService;
import io.github.casevault.service.GrantOutcome;
import io.github.casevault.service.RevokeOutcome;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
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

/** Direct grant management by the case owner (or an administrator). */
@Path("/v1/cases/{caseId}/access")
@Produces(MediaType.APPLICATION_JSON)
public class CaseAccessResource {

    @Inject RequestGuard guard;

    @Inject CaseAccessService caseAccessService;

    @GET
    public Response listGrants(@Context HttpHeaders headers, @PathParam("caseId") String caseId) {
        GuardDecision decision =
                guard.requireCaseOwnership(Credentials.fromHeaders(headers), caseId);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        UUID id = UUID.fromString(caseId.trim());
        return Response.ok(Map.of("data", caseAccessService.listGrants(id))).build();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response grant(
            @Context HttpHeaders headers,
            @PathParam("caseId") String caseId,
            @NotNull @Valid GrantAccessRequest request) {
        GuardDecision decision =
                guard.requireCaseOwnership(Credentials.fromHeaders(headers), caseId);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        Optional<UUID> lawyerId = ApiResponses.parseUuid(request.getLawyerId());
        if (lawyerId.isEmpty()) {
            return ApiResponses.badRequest("Invalid lawyer id: " + request.getLawyerId());
        }
        UUID id = UUID.fromString(caseId.trim());
        GrantOutcome outcome = caseAccessService.grant(id, lawyerId.get());
        if (outcome.isError()) {
            return ApiResponses.badRequest("Access cannot be granted: " + outcome);
        }
        Map<String, Object> body =
                Map.of(
                        "caseId", id.toString(),
                        "lawyerId", lawyerId.get().toString(),
                        "outcome", outcome.name());
        Response.Status status =
                outcome == GrantOutcome.GRANTED ? Response.Status.CREATED : Response.Status.OK;
        return Response.status(status).entity(body).build();
    }

    @DELETE
    @Path("/{lawyerId}")
    public Response revoke(
            @Context HttpHeaders headers,
            @PathParam("caseId") String caseId,
            @PathParam("lawyerId") String lawyerId) {
        GuardDecision decision =
                guard.requireCaseOwnership(Credentials.fromHeaders(headers), caseId);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        Optional<UUID> lawyer = ApiResponses.parseUuid(lawyerId);
        if (lawyer.isEmpty()) {
            return ApiResponses.badRequest("Invalid lawyer id: " + lawyerId);
        }
        RevokeOutcome outcome =
                caseAccessService.revoke(UUID.fromString(caseId.trim()), lawyer.get());
        if (outcome == RevokeOutcome.NOT_GRANTED) {
            return ApiResponses.notFound("grant", lawyerId);
        }
        return Response.noContent().build();
    }
}
