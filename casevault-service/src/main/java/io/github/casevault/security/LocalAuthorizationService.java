package io.github.casevault.security;

import io.github.casevault.persistence.repo.CaseRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Database-backed authorization engine. Every decision is a single query against the case table
 * whose predicate depends on the principal's role:
 *
 * <ul>
 *   <li>ADMIN → the case exists
 *   <li>CLIENT → the case is owned by the principal
 *   <li>LAWYER → a grant row exists for (case, principal)
 * </ul>
 *
 * <p>Store errors are logged and reported as denial.
 */
@ApplicationScoped
public class LocalAuthorizationService implements AuthorizationService {

    private static final Logger LOG = Logger.getLogger(LocalAuthorizationService.class);

    @Inject CaseRepository caseRepository;

    @Override
    public boolean canAccess(Principal principal, UUID caseId) {
        if (principal == null || caseId == null) {
            return false;
        }
        try {
            boolean allowed =
                    switch (principal.role()) {
                        case ADMIN -> caseRepository.exists(caseId);
                        case CLIENT -> caseRepository.isOwnedBy(caseId, principal.id());
                        case LAWYER -> caseRepository.isGrantedTo(caseId, principal.id());
                    };
            if (!allowed) {
                LOG.warnf(
                        "Access denied: user %s (%s) attempted to access case %s",
                        principal.email(), principal.role(), caseId);
            }
            return allowed;
        } catch (RuntimeException e) {
            LOG.errorf(
                    e,
                    "Authorization check failed for user %s on case %s",
                    principal.id(),
                    caseId);
            return false;
        }
    }

    @Override
    public boolean isOwner(Principal principal, UUID caseId) {
        if (principal == null || caseId == null) {
            return false;
        }
        try {
            boolean owner =
                    switch (principal.role()) {
                        // Owner-equivalent, but only for cases that exist.
                        case ADMIN -> caseRepository.exists(caseId);
                        case CLIENT -> caseRepository.isOwnedBy(caseId, principal.id());
                        case LAWYER -> false;
                    };
            if (!owner) {
                LOG.warnf(
                        "Ownership denied: user %s (%s) is not an owner of case %s",
                        principal.email(), principal.role(), caseId);
            }
            return owner;
        } catch (RuntimeException e) {
            LOG.errorf(
                    e, "Ownership check failed for user %s on case %s", principal.id(), caseId);
            return false;
        }
    }

    @Override
    public Set<UUID> listAccessibleCaseIds(Principal principal) {
        if (principal == null) {
            return Set.of();
        }
        try {
            List<UUID> ids =
                    switch (principal.role()) {
                        case ADMIN -> caseRepository.listIds();
                        case CLIENT -> caseRepository.listIdsOwnedBy(principal.id());
                        case LAWYER -> caseRepository.listIdsGrantedTo(principal.id());
                    };
            return Set.copyOf(ids);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to list accessible cases for user %s", principal.id());
            return Set.of();
        }
    }

    @Override
    public Set<UUID> filterAccessible(Principal principal, Collection<UUID> caseIds) {
        if (principal == null || caseIds == null || caseIds.isEmpty()) {
            return Set.of();
        }
        Set<UUID> requested = new HashSet<>(caseIds);
        requested.remove(null);
        if (requested.isEmpty()) {
            return Set.of();
        }
        try {
            List<UUID> ids =
                    switch (principal.role()) {
                        case ADMIN -> caseRepository.filterExisting(requested);
                        case CLIENT -> caseRepository.filterOwnedBy(requested, principal.id());
                        case LAWYER -> caseRepository.filterGrantedTo(requested, principal.id());
                    };
            Set<UUID> allowed = new HashSet<>(ids);
            allowed.retainAll(requested);
            return Set.copyOf(allowed);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Batch access check failed for user %s", principal.id());
            return Set.of();
        }
    }
}
