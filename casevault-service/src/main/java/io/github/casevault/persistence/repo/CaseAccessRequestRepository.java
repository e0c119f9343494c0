package io.github.casevault.persistence.repo;

import io.github.casevault.model.AccessRequestStatus;
import io.github.casevault.persistence.entity.CaseAccessRequestEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for access requests. At most one PENDING row may exist per (case, lawyer); terminal
 * rows are kept as history.
 */
@ApplicationScoped
public class CaseAccessRequestRepository
        implements PanacheRepositoryBase<CaseAccessRequestEntity, UUID> {

    public Optional<CaseAccessRequestEntity> findPending(UUID caseId, UUID lawyerId) {
        return find(
                        "caseId = ?1 AND lawyerId = ?2 AND status = ?3",
                        caseId,
                        lawyerId,
                        AccessRequestStatus.PENDING)
                .firstResultOptional();
    }

    /** Most recent rejection for the pair, used to enforce the re-submission cooldown. */
    public Optional<CaseAccessRequestEntity> findLatestRejected(UUID caseId, UUID lawyerId) {
        return find(
                        "caseId = ?1 AND lawyerId = ?2 AND status = ?3 ORDER BY reviewedAt DESC",
                        caseId,
                        lawyerId,
                        AccessRequestStatus.REJECTED)
                .firstResultOptional();
    }

    /** Loads the request with a row lock so concurrent reviews of the same request serialize. */
    public Optional<CaseAccessRequestEntity> findForReview(UUID requestId) {
        return findByIdOptional(requestId, LockModeType.PESSIMISTIC_WRITE);
    }

    public List<CaseAccessRequestEntity> listForCase(UUID caseId) {
        return list("caseId = ?1 ORDER BY requestedAt DESC", caseId);
    }

    public List<CaseAccessRequestEntity> listForLawyer(UUID lawyerId) {
        return list("lawyerId = ?1 ORDER BY requestedAt DESC", lawyerId);
    }
}
