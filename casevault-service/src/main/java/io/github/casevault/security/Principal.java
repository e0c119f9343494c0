package io.github.casevault.security;

import io.github.casevault.model.UserRole;
import java.util.UUID;

/** An authenticated actor as seen by the authorization engine. */
public record Principal(UUID id, String email, UserRole role, boolean active) {

    public boolean hasRole(UserRole candidate) {
        return role == candidate;
    }
}
