package io.github.casevault.persistence.repo;

import io.github.casevault.persistence.entity.CaseAccessEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class CaseAccessRepository implements PanacheRepositoryBase<CaseAccessEntity, UUID> {

    @Inject EntityManager entityManager;

    public boolean hasGrant(UUID caseId, UUID lawyerId) {
        return count("caseId = ?1 AND lawyerId = ?2", caseId, lawyerId) > 0;
    }

    public List<CaseAccessEntity> listForCase(UUID caseId) {
        return list("caseId = ?1 ORDER BY grantedAt", caseId);
    }

    /**
     * Inserts the grant unless one already exists for the pair. Concurrent callers race on the
     * unique (case_id, lawyer_id) index; exactly one of them sees a row count of 1.
     *
     * @return {@code true} if a row was inserted
     */
    public boolean insertIfAbsent(UUID caseId, UUID lawyerId) {
        // The native statement bypasses the session, so pending case rows go out first.
        flush();
        int inserted =
                entityManager
                        .createNativeQuery(
                                "INSERT INTO case_access (id, case_id, lawyer_id, granted_at)"
                                        + " VALUES (?1, ?2, ?3, ?4) ON CONFLICT DO NOTHING")
                        .setParameter(1, UUID.randomUUID())
                        .setParameter(2, caseId)
                        .setParameter(3, lawyerId)
                        .setParameter(4, OffsetDateTime.now())
                        .executeUpdate();
        return inserted > 0;
    }

    public long deleteGrant(UUID caseId, UUID lawyerId) {
        return delete("caseId = ?1 AND lawyerId = ?2", caseId, lawyerId);
    }
}
