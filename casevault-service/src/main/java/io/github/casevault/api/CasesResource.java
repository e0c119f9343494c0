package io.github.casevault.api;

import io.github.casevault.api.dto.CaseDto;
import io.github.casevault.api.dto.CreateCaseRequest;
import io.github.casevault.api.dto.FilterCasesRequest;
import io.github.casevault.api.dto.UpdateCaseRequest;
import io.github.casevault.model.CaseCategory;
import io.github.casevault.model.CaseStatus;
import io.github.casevault.model.UserRole;
import io.github.casevault.security.AuthorizationService;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.security.RequestGuard;
import io.github.casevault.service.CaseService;
import io.github.casevault.store.AccessDeniedException;
import io.github.casevault.store.ResourceNotFoundException;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Path("/v1/cases")
@Produces(MediaType.APPLICATION_JSON)
public class CasesResource {

    @Inject RequestGuard guard;

    @Inject AuthorizationService authorizationService;

    @Inject CaseService caseService;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response createCase(
            @Context HttpHeaders headers, @NotNull @Valid CreateCaseRequest request) {
        GuardDecision decision =
                guard.requireRole(Credentials.fromHeaders(headers), UserRole.CLIENT);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        try {
            CaseDto created = caseService.create(decision.principal(), request);
            return Response.status(Response.Status.CREATED).entity(created).build();
        } catch (AccessDeniedException e) {
            return ApiResponses.forbidden(e.getMessage());
        }
    }

    @GET
    public Response listCases(
            @Context HttpHeaders headers,
            @QueryParam("search") String search,
            @QueryParam("status") String status,
            @QueryParam("category") String category) {
        GuardDecision decision = guard.requireAuth(Credentials.fromHeaders(headers));
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        CaseStatus statusFilter;
        CaseCategory categoryFilter;
        try {
            statusFilter = parseEnum(CaseStatus.class, status);
            categoryFilter = parseEnum(CaseCategory.class, category);
        } catch (IllegalArgumentException e) {
            return ApiResponses.badRequest(e.getMessage());
        }
        Set<UUID> ids = authorizationService.listAccessibleCaseIds(decision.principal());
        List<CaseDto> cases = caseService.search(ids, search, statusFilter, categoryFilter);
        return Response.ok(Map.of("data", cases)).build();
    }

    /** Reduces a posted list of case ids to the ones the caller may read. */
    @POST
    @Path("/accessible")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response filterAccessible(
            @Context HttpHeaders headers, @NotNull @Valid FilterCasesRequest request) {
        GuardDecision decision = guard.requireAuth(Credentials.fromHeaders(headers));
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        List<UUID> requested = new ArrayList<>();
        for (String raw : request.getCaseIds()) {
            Optional<UUID> id = ApiResponses.parseUuid(raw);
            if (id.isEmpty()) {
                return ApiResponses.badRequest("Invalid case id: " + raw);
            }
            requested.add(id.get());
        }
        Set<UUID> allowed = authorizationService.filterAccessible(decision.principal(), requested);
        List<String> data = allowed.stream().map(UUID::toString).sorted().toList();
        return Response.ok(Map.of("data", data)).build();
    }

    @GET
    @Path("/{caseId}")
    public Response getCase(@Context HttpHeaders headers, @PathParam("caseId") String caseId) {
        GuardDecision decision = guard.requireCaseAccess(Credentials.fromHeaders(headers), caseId);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        // The guard only lets existing cases through.
        return caseService
                .find(UUID.fromString(caseId.trim()))
                .map(dto -> Response.ok(dto).build())
                .orElseGet(() -> ApiResponses.forbidden("Not allowed"));
    }

    @PUT
    @Path("/{caseId}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response replaceCase(
            @Context HttpHeaders headers,
            @PathParam("caseId") String caseId,
            @NotNull @Valid UpdateCaseRequest request) {
        return updateCase(headers, caseId, request);
    }

    @PATCH
    @Path("/{caseId}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response updateCase(
            @Context HttpHeaders headers,
            @PathParam("caseId") String caseId,
            @NotNull @Valid UpdateCaseRequest request) {
        GuardDecision decision =
                guard.requireCaseOwnership(Credentials.fromHeaders(headers), caseId);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        try {
            return Response.ok(caseService.update(UUID.fromString(caseId.trim()), request))
                    .build();
        } catch (IllegalArgumentException e) {
            return ApiResponses.badRequest(e.getMessage());
        } catch (ResourceNotFoundException e) {
            // Deleted after the ownership check.
            return ApiResponses.forbidden("Not allowed");
        }
    }

    @DELETE
    @Path("/{caseId}")
    public Response deleteCase(@Context HttpHeaders headers, @PathParam("caseId") String caseId) {
        GuardDecision decision =
                guard.requireCaseOwnership(Credentials.fromHeaders(headers), caseId);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        if (!caseService.delete(UUID.fromString(caseId.trim()))) {
            return ApiResponses.forbidden("Not allowed");
        }
        return Response.noContent().build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid " + type.getSimpleName() + ": " + value, e);
        }
    }
}
