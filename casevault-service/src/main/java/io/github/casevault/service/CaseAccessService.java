package io.github.casevault.service;

import io.github.casevault.api.dto.AccessGrantDto;
import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.entity.CaseAccessEntity;
import io.github.casevault.persistence.entity.UserEntity;
import io.github.casevault.persistence.repo.CaseAccessRepository;
import io.github.casevault.persistence.repo.CaseRepository;
import io.github.casevault.persistence.repo.UserRepository;
import io.github.casevault.security.AccessAuditLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Writes and removes case grants. Only active LAWYER accounts can hold a grant, and a pair holds
 * at most one.
 */
@ApplicationScoped
public class CaseAccessService {

    private static final Logger LOG = Logger.getLogger(CaseAccessService.class);

    @Inject CaseAccessRepository caseAccessRepository;

    @Inject CaseRepository caseRepository;

    @Inject UserRepository userRepository;

    @Inject AccessAuditLogger auditLogger;

    /**
     * Grant a lawyer access to a case. Joins the caller's transaction when there is one, so a
     * failure of the enclosing unit also discards the grant.
     */
    @Transactional
    public GrantOutcome grant(UUID caseId, UUID lawyerId) {
        if (caseId == null || !caseRepository.exists(caseId)) {
            return GrantOutcome.CASE_NOT_FOUND;
        }
        Optional<UserEntity> lawyer =
                lawyerId == null ? Optional.empty() : userRepository.findByIdOptional(lawyerId);
        if (lawyer.isEmpty()) {
            return GrantOutcome.USER_NOT_FOUND;
        }
        if (lawyer.get().getRole() != UserRole.LAWYER) {
            LOG.infof("Refusing grant on case %s to non-lawyer %s", caseId, lawyerId);
            return GrantOutcome.WRONG_ROLE;
        }
        if (!lawyer.get().isActive()) {
            LOG.infof("Refusing grant on case %s to inactive lawyer %s", caseId, lawyerId);
            return GrantOutcome.INACTIVE;
        }
        if (!caseAccessRepository.insertIfAbsent(caseId, lawyerId)) {
            return GrantOutcome.ALREADY_GRANTED;
        }
        auditLogger.logGrant(caseId, lawyerId);
        return GrantOutcome.GRANTED;
    }

    @Transactional
    public RevokeOutcome revoke(UUID caseId, UUID lawyerId) {
        if (caseId == null || lawyerId == null) {
            return RevokeOutcome.NOT_GRANTED;
        }
        if (caseAccessRepository.deleteGrant(caseId, lawyerId) == 0) {
            return RevokeOutcome.NOT_GRANTED;
        }
        auditLogger.logRevoke(caseId, lawyerId);
        return RevokeOutcome.REVOKED;
    }

    public boolean hasGrant(UUID caseId, UUID lawyerId) {
        if (caseId == null || lawyerId == null) {
            return false;
        }
        return caseAccessRepository.hasGrant(caseId, lawyerId);
    }

    public List<AccessGrantDto> listGrants(UUID caseId) {
        return caseAccessRepository.listForCase(caseId).stream().map(this::toDto).toList();
    }

    private AccessGrantDto toDto(CaseAccessEntity entity) {
        AccessGrantDto dto = new AccessGrantDto();
        dto.setId(entity.getId().toString());
        dto.setCaseId(entity.getCaseId().toString());
        dto.setLawyerId(entity.getLawyerId().toString());
        dto.setGrantedAt(entity.getGrantedAt().toString());
        userRepository
                .findByIdOptional(entity.getLawyerId())
                .ifPresent(
                        lawyer -> {
                            dto.setLawyerEmail(lawyer.getEmail());
                            dto.setLawyerName(lawyer.getFirstName() + " " + lawyer.getLastName());
                        });
        return dto;
    }
}
