package io.github.casevault.security;

import io.github.casevault.model.UserRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Entry checks for protected operations. Each method resolves the caller, applies one rule and
 * reports the result as a {@link GuardDecision}; nothing is thrown and nothing is written, so any
 * check can be retried freely.
 *
 * <p>Case checks answer FORBIDDEN for malformed ids, missing cases and denied cases alike.
 */
@ApplicationScoped
public class RequestGuard {

    private static final Logger LOG = Logger.getLogger(RequestGuard.class);

    @Inject PrincipalResolver principalResolver;

    @Inject AuthorizationService authorizationService;

    public GuardDecision requireAuth(String credential) {
        Optional<Principal> principal;
        try {
            principal = principalResolver.resolve(credential);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Principal resolution failed");
            return GuardDecision.unauthenticated();
        }
        if (principal.isEmpty()) {
            return GuardDecision.unauthenticated();
        }
        if (!principal.get().active()) {
            LOG.infof("Rejected credential of deactivated user %s", principal.get().id());
            return GuardDecision.unauthenticated();
        }
        return GuardDecision.allowed(principal.get());
    }

    public GuardDecision requireRole(String credential, UserRole... roles) {
        GuardDecision auth = requireAuth(credential);
        if (!auth.isAllowed()) {
            return auth;
        }
        Principal principal = auth.principal();
        if (Arrays.asList(roles).contains(principal.role())) {
            return auth;
        }
        LOG.warnf(
                "Role denied: user %s (%s) requires one of %s",
                principal.email(), principal.role(), Arrays.toString(roles));
        return GuardDecision.forbidden(principal);
    }

    public GuardDecision requireCaseAccess(String credential, String caseId) {
        GuardDecision auth = requireAuth(credential);
        if (!auth.isAllowed()) {
            return auth;
        }
        Principal principal = auth.principal();
        Optional<UUID> id = parseId(caseId);
        if (id.isPresent() && authorizationService.canAccess(principal, id.get())) {
            return auth;
        }
        return GuardDecision.forbidden(principal);
    }

    public GuardDecision requireCaseOwnership(String credential, String caseId) {
        GuardDecision auth = requireAuth(credential);
        if (!auth.isAllowed()) {
            return auth;
        }
        Principal principal = auth.principal();
        Optional<UUID> id = parseId(caseId);
        if (id.isPresent() && authorizationService.isOwner(principal, id.get())) {
            return auth;
        }
        return GuardDecision.forbidden(principal);
    }

    static Optional<UUID> parseId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
