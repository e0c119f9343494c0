package io.github.casevault.persistence.repo;

import io.github.casevault.model.CaseCategory;
import io.github.casevault.model.CaseStatus;
import io.github.casevault.persistence.entity.CaseEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Case lookups used by the authorization engine. Each predicate method issues exactly one query
 * so that a missing case and a denied case cost the same and look the same to callers.
 */
@ApplicationScoped
public class CaseRepository implements PanacheRepositoryBase<CaseEntity, UUID> {

    private static final String GRANT_EXISTS =
            "exists (select a.id from CaseAccessEntity a where a.caseId = c.id and a.lawyerId ="
                    + " :lawyerId)";

    @Inject EntityManager entityManager;

    public boolean exists(UUID caseId) {
        return count("id = ?1", caseId) > 0;
    }

    public boolean isOwnedBy(UUID caseId, UUID ownerId) {
        return count("id = ?1 AND ownerId = ?2", caseId, ownerId) > 0;
    }

    public boolean isGrantedTo(UUID caseId, UUID lawyerId) {
        Long count =
                entityManager
                        .createQuery(
                                "select count(c) from CaseEntity c where c.id = :caseId and "
                                        + GRANT_EXISTS,
                                Long.class)
                        .setParameter("caseId", caseId)
                        .setParameter("lawyerId", lawyerId)
                        .getSingleResult();
        return count != null && count > 0;
    }

    public List<UUID> listIds() {
        return entityManager
                .createQuery("select c.id from CaseEntity c", UUID.class)
                .getResultList();
    }

    public List<UUID> listIdsOwnedBy(UUID ownerId) {
        return entityManager
                .createQuery("select c.id from CaseEntity c where c.ownerId = :ownerId", UUID.class)
                .setParameter("ownerId", ownerId)
                .getResultList();
    }

    public List<UUID> listIdsGrantedTo(UUID lawyerId) {
        return entityManager
                .createQuery(
                        "select a.caseId from CaseAccessEntity a where a.lawyerId = :lawyerId",
                        UUID.class)
                .setParameter("lawyerId", lawyerId)
                .getResultList();
    }

    public List<UUID> filterExisting(Collection<UUID> caseIds) {
        return entityManager
                .createQuery("select c.id from CaseEntity c where c.id in :caseIds", UUID.class)
                .setParameter("caseIds", caseIds)
                .getResultList();
    }

    public List<UUID> filterOwnedBy(Collection<UUID> caseIds, UUID ownerId) {
        return entityManager
                .createQuery(
                        "select c.id from CaseEntity c where c.id in :caseIds and c.ownerId ="
                                + " :ownerId",
                        UUID.class)
                .setParameter("caseIds", caseIds)
                .setParameter("ownerId", ownerId)
                .getResultList();
    }

    public List<UUID> filterGrantedTo(Collection<UUID> caseIds, UUID lawyerId) {
        return entityManager
                .createQuery(
                        "select c.id from CaseEntity c where c.id in :caseIds and " + GRANT_EXISTS,
                        UUID.class)
                .setParameter("caseIds", caseIds)
                .setParameter("lawyerId", lawyerId)
                .getResultList();
    }

    /**
     * Cases among {@code caseIds} that match every non-null filter, newest first. {@code title}
     * is a case-insensitive substring match.
     */
    public List<CaseEntity> search(
            Collection<UUID> caseIds, String title, CaseStatus status, CaseCategory category) {
        if (caseIds.isEmpty()) {
            return List.of();
        }
        StringBuilder jpql = new StringBuilder("SELECT c FROM CaseEntity c WHERE c.id IN :caseIds");
        if (title != null) {
            jpql.append(" AND LOWER(c.title) LIKE :title");
        }
        if (status != null) {
            jpql.append(" AND c.status = :status");
        }
        if (category != null) {
            jpql.append(" AND c.category = :category");
        }
        jpql.append(" ORDER BY c.createdAt DESC");

        var query =
                entityManager
                        .createQuery(jpql.toString(), CaseEntity.class)
                        .setParameter("caseIds", caseIds);
        if (title != null) {
            query.setParameter("title", "%" + title.toLowerCase() + "%");
        }
        if (status != null) {
            query.setParameter("status", status);
        }
        if (category != null) {
            query.setParameter("category", category);
        }
        return query.getResultList();
    }
}
