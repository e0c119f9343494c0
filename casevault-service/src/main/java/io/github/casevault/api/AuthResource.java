package io.github.casevault.api;

import io.github.casevault.api.dto.LoginRequest;
import io.github.casevault.api.dto.RegisterRequest;
import io.github.casevault.api.dto.SessionDto;
import io.github.casevault.persistence.entity.UserEntity;
import io.github.casevault.security.GuardDecision;
import io.github.casevault.security.RequestGuard;
import io.github.casevault.service.IssuedSession;
import io.github.casevault.service.SessionService;
import io.github.casevault.service.UserService;
import io.github.casevault.store.ResourceConflictException;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

@Path("/v1/auth")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    @Inject UserService userService;

    @Inject SessionService sessionService;

    @Inject RequestGuard guard;

    @POST
    @Path("/register")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response register(@NotNull @Valid RegisterRequest request) {
        try {
            UserEntity user =
                    userService.register(
                            request.getEmail(),
                            request.getPassword(),
                            request.getFirstName(),
                            request.getLastName(),
                            request.getRole());
            return Response.status(Response.Status.CREATED)
                    .entity(UserService.toDto(user))
                    .build();
        } catch (ResourceConflictException e) {
            return ApiResponses.conflict(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ApiResponses.badRequest(e.getMessage());
        }
    }

    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response login(@NotNull @Valid LoginRequest request) {
        Optional<UserEntity> user =
                userService.authenticate(request.getEmail(), request.getPassword());
        if (user.isEmpty()) {
            return ApiResponses.unauthenticated("Invalid email or password");
        }
        IssuedSession session = sessionService.open(user.get());

        SessionDto dto = new SessionDto();
        dto.setToken(session.token());
        dto.setExpiresAt(session.expiresAt().toString());
        dto.setUser(UserService.toDto(user.get()));
        long maxAge = Duration.between(OffsetDateTime.now(), session.expiresAt()).toSeconds();
        return Response.ok(dto).cookie(sessionCookie(session.token(), (int) maxAge)).build();
    }

    @POST
    @Path("/logout")
    public Response logout(@Context HttpHeaders headers) {
        String credential = Credentials.fromHeaders(headers);
        GuardDecision decision = guard.requireAuth(credential);
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        sessionService.close(credential);
        return Response.noContent().cookie(sessionCookie("", 0)).build();
    }

    @GET
    @Path("/me")
    public Response me(@Context HttpHeaders headers) {
        GuardDecision decision = guard.requireAuth(Credentials.fromHeaders(headers));
        if (!decision.isAllowed()) {
            return ApiResponses.denied(decision);
        }
        return userService
                .findById(decision.principal().id())
                .map(user -> Response.ok(UserService.toDto(user)).build())
                .orElseGet(() -> ApiResponses.unauthenticated("Account no longer exists"));
    }

    private static NewCookie sessionCookie(String value, int maxAge) {
        return new NewCookie.Builder(Credentials.SESSION_COOKIE)
                .value(value)
                .path("/")
                .maxAge(maxAge)
                .httpOnly(true)
                .sameSite(NewCookie.SameSite.LAX)
                .build();
    }
}
