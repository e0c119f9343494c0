package io.github.casevault.security;

import io.github.casevault.persistence.entity.UserEntity;
import io.github.casevault.service.SessionService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;

/** Resolves principals from the shared {@code user_sessions} table on every call. */
@ApplicationScoped
public class SessionPrincipalResolver implements PrincipalResolver {

    @Inject SessionService sessionService;

    @Override
    public Optional<Principal> resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            return Optional.empty();
        }
        return sessionService
                .findSessionUser(credential.trim())
                .map(SessionPrincipalResolver::toPrincipal);
    }

    static Principal toPrincipal(UserEntity user) {
        return new Principal(user.getId(), user.getEmail(), user.getRole(), user.isActive());
    }
}
