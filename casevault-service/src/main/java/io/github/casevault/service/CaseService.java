package io.github.casevault.service;

import io.github.casevault.api.dto.CaseDto;
import io.github.casevault.api.dto.CreateCaseRequest;
import io.github.casevault.api.dto.UpdateCaseRequest;
import io.github.casevault.model.CaseCategory;
import io.github.casevault.model.CaseStatus;
import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.entity.CaseEntity;
import io.github.casevault.persistence.repo.CaseRepository;
import io.github.casevault.security.Principal;
import io.github.casevault.store.AccessDeniedException;
import io.github.casevault.store.ResourceNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Case creation, reads, updates and deletion. Callers are expected to have passed the request
 * guard; this class does not make access decisions beyond requiring a CLIENT owner.
 */
@ApplicationScoped
public class CaseService {

    private static final Logger LOG = Logger.getLogger(CaseService.class);

    private static final int DEFAULT_PRIORITY = 2;

    @Inject CaseRepository caseRepository;

    @Transactional
    public CaseDto create(Principal owner, CreateCaseRequest request) {
        if (owner == null || !owner.hasRole(UserRole.CLIENT)) {
            throw new AccessDeniedException("Only clients can own cases");
        }
        CaseEntity entity = new CaseEntity();
        entity.setTitle(request.getTitle().trim());
        entity.setDescription(request.getDescription());
        entity.setCategory(request.getCategory());
        entity.setStatus(CaseStatus.OPEN);
        entity.setPriority(
                request.getPriority() != null ? request.getPriority() : DEFAULT_PRIORITY);
        entity.setOwnerId(owner.id());
        caseRepository.persist(entity);
        LOG.infof("Case %s created by %s", entity.getId(), owner.id());
        return toDto(entity);
    }

    public Optional<CaseDto> find(UUID caseId) {
        return caseRepository.findByIdOptional(caseId).map(CaseService::toDto);
    }

    /** Cases among {@code caseIds} narrowed by the optional title search, status and category. */
    public List<CaseDto> search(
            Collection<UUID> caseIds, String title, CaseStatus status, CaseCategory category) {
        String term = title == null || title.isBlank() ? null : title.trim();
        return caseRepository.search(caseIds, term, status, category).stream()
                .map(CaseService::toDto)
                .toList();
    }

    /**
     * Apply the non-null fields of {@code request}. The owner is never changed.
     *
     * @throws IllegalArgumentException if no field is set or the title is blank
     * @throws ResourceNotFoundException if the case does not exist
     */
    @Transactional
    public CaseDto update(UUID caseId, UpdateCaseRequest request) {
        if (request.isEmpty()) {
            throw new IllegalArgumentException("At least one field must be provided for update");
        }
        if (request.getTitle() != null && request.getTitle().isBlank()) {
            throw new IllegalArgumentException("Title cannot be empty");
        }
        CaseEntity entity =
                caseRepository
                        .findByIdOptional(caseId)
                        .orElseThrow(
                                () -> new ResourceNotFoundException("case", caseId.toString()));
        if (request.getTitle() != null) {
            entity.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            entity.setDescription(request.getDescription());
        }
        if (request.getCategory() != null) {
            entity.setCategory(request.getCategory());
        }
        if (request.getStatus() != null) {
            entity.setStatus(request.getStatus());
        }
        if (request.getPriority() != null) {
            entity.setPriority(request.getPriority());
        }
        caseRepository.flush();
        LOG.infof("Case %s updated", caseId);
        return toDto(entity);
    }

    /**
     * Delete a case. Its grants and access requests go with it.
     *
     * @return false if the case did not exist
     */
    @Transactional
    public boolean delete(UUID caseId) {
        boolean deleted = caseRepository.deleteById(caseId);
        if (deleted) {
            LOG.infof("Case %s deleted", caseId);
        }
        return deleted;
    }

    static CaseDto toDto(CaseEntity entity) {
        CaseDto dto = new CaseDto();
        dto.setId(entity.getId().toString());
        dto.setTitle(entity.getTitle());
        dto.setDescription(entity.getDescription());
        dto.setCategory(entity.getCategory());
        dto.setStatus(entity.getStatus());
        dto.setPriority(entity.getPriority());
        dto.setOwnerId(entity.getOwnerId().toString());
        if (entity.getCreatedAt() != null) {
            dto.setCreatedAt(entity.getCreatedAt().toString());
        }
        if (entity.getUpdatedAt() != null) {
            dto.setUpdatedAt(entity.getUpdatedAt().toString());
        }
        return dto;
    }
}
