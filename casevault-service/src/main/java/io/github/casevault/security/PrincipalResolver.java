package io.github.casevault.security;

import java.util.Optional;

/**
 * Turns the credential material of a request (a bearer token or session cookie value) into a
 * {@link Principal}. Implementations must not cache resolutions in process: the backing store is
 * the only source of truth for which sessions are live.
 */
public interface PrincipalResolver {

    /**
     * Returns the principal owning the credential, or empty if the credential is missing,
     * unknown or expired.
     */
    Optional<Principal> resolve(String credential);
}
