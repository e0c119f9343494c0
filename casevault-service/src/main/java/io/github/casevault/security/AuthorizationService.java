package io.github.casevault.security;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * Decides whether a resolved principal may act on a case. Implementations never throw: a store
 * failure is reported as a denial, indistinguishable from a genuine one.
 */
public interface AuthorizationService {

    /**
     * Returns {@code true} if the principal may read or act on the case. ADMIN may access every
     * existing case, CLIENT only the cases it owns, LAWYER only the cases granted to it. A
     * nonexistent case is never accessible.
     */
    boolean canAccess(Principal principal, UUID caseId);

    /**
     * Returns {@code true} if the principal holds owner-level rights on the case. ADMIN is
     * owner-equivalent for every existing case; LAWYER never owns.
     */
    boolean isOwner(Principal principal, UUID caseId);

    /** All case ids the principal can access. */
    Set<UUID> listAccessibleCaseIds(Principal principal);

    /**
     * The subset of {@code caseIds} the principal can access, evaluated in one query. The result
     * is always contained in the input.
     */
    Set<UUID> filterAccessible(Principal principal, Collection<UUID> caseIds);
}
