package io.github.casevault.service;

import io.github.casevault.api.dto.AccessRequestDto;
import io.github.casevault.model.AccessRequestStatus;
import io.github.casevault.model.ReviewDecision;
import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.entity.CaseAccessRequestEntity;
import io.github.casevault.persistence.repo.CaseAccessRepository;
import io.github.casevault.persistence.repo.CaseAccessRequestRepository;
import io.github.casevault.persistence.repo.CaseRepository;
import io.github.casevault.security.AccessAuditLogger;
import io.github.casevault.security.AuthorizationService;
import io.github.casevault.security.Principal;
import io.github.casevault.service.AccessRequestException.Reason;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Lawyer-initiated requests for access to a case.
 *
 * <p>A request starts PENDING and is reviewed exactly once, by the case owner or an administrator.
 * Approval writes the grant and the status change in one transaction: if the grant is refused the
 * whole unit rolls back and the request stays PENDING. A lawyer whose request was rejected may ask
 * again once the configured cooldown has passed.
 */
@ApplicationScoped
public class AccessRequestService {

    private static final Logger LOG = Logger.getLogger(AccessRequestService.class);

    @ConfigProperty(name = "casevault.access-requests.resubmit-cooldown", defaultValue = "PT24H")
    Duration resubmitCooldown;

    @Inject CaseAccessRequestRepository requestRepository;

    @Inject CaseAccessRepository caseAccessRepository;

    @Inject CaseRepository caseRepository;

    @Inject CaseAccessService caseAccessService;

    @Inject AuthorizationService authorizationService;

    @Inject AccessAuditLogger auditLogger;

    @Transactional
    public AccessRequestDto submit(Principal lawyer, UUID caseId) {
        requireLawyer(lawyer);
        if (caseId == null || !caseRepository.exists(caseId)) {
            throw new AccessRequestException(Reason.CASE_NOT_FOUND, "Case not found: " + caseId);
        }
        if (caseAccessRepository.hasGrant(caseId, lawyer.id())) {
            throw new AccessRequestException(
                    Reason.ALREADY_GRANTED, "Access to this case is already granted");
        }
        if (requestRepository.findPending(caseId, lawyer.id()).isPresent()) {
            throw new AccessRequestException(
                    Reason.DUPLICATE_PENDING, "A pending request for this case already exists");
        }
        Optional<OffsetDateTime> retryAt = nextAllowedSubmission(caseId, lawyer.id());
        if (retryAt.isPresent()) {
            throw new AccessRequestException(
                    Reason.RESUBMIT_COOLDOWN,
                    "A rejected request can be resubmitted after " + retryAt.get());
        }

        CaseAccessRequestEntity request = new CaseAccessRequestEntity();
        request.setCaseId(caseId);
        request.setLawyerId(lawyer.id());
        request.setStatus(AccessRequestStatus.PENDING);
        request.setRequestedAt(OffsetDateTime.now());
        requestRepository.persist(request);

        auditLogger.logRequestSubmitted(request.getId(), caseId, lawyer.id());
        return toDto(request);
    }

    @Transactional
    public AccessRequestDto review(UUID requestId, Principal reviewer, ReviewDecision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        CaseAccessRequestEntity request =
                (requestId == null
                                ? Optional.<CaseAccessRequestEntity>empty()
                                : requestRepository.findForReview(requestId))
                        .orElseThrow(
                                () ->
                                        new AccessRequestException(
                                                Reason.REQUEST_NOT_FOUND,
                                                "Access request not found: " + requestId));

        if (!authorizationService.isOwner(reviewer, request.getCaseId())) {
            throw new AccessRequestException(
                    Reason.NOT_REVIEWER, "Only the case owner or an administrator may review");
        }
        if (request.getStatus().isTerminal()) {
            throw new AccessRequestException(
                    Reason.ALREADY_REVIEWED,
                    "Access request was already " + request.getStatus().name().toLowerCase());
        }

        if (decision == ReviewDecision.APPROVE) {
            GrantOutcome outcome =
                    caseAccessService.grant(request.getCaseId(), request.getLawyerId());
            if (outcome.isError()) {
                LOG.warnf(
                        "Approval of request %s failed, grant refused with %s", requestId, outcome);
                throw new AccessRequestException(
                        Reason.GRANT_FAILED, outcome, "Access could not be granted: " + outcome);
            }
            request.setStatus(AccessRequestStatus.APPROVED);
        } else {
            request.setStatus(AccessRequestStatus.REJECTED);
        }
        request.setReviewedAt(OffsetDateTime.now());
        request.setReviewedBy(reviewer.id());

        auditLogger.logReview(
                request.getId(),
                request.getCaseId(),
                request.getLawyerId(),
                reviewer.id(),
                decision);
        return toDto(request);
    }

    /** Deletes the caller's PENDING request for a case. */
    @Transactional
    public void withdraw(Principal lawyer, UUID caseId) {
        requireLawyer(lawyer);
        CaseAccessRequestEntity request =
                (caseId == null
                                ? Optional.<CaseAccessRequestEntity>empty()
                                : requestRepository.findPending(caseId, lawyer.id()))
                        .orElseThrow(
                                () ->
                                        new AccessRequestException(
                                                Reason.NO_PENDING_REQUEST,
                                                "No pending request for case " + caseId));
        requestRepository.delete(request);
        auditLogger.logRequestWithdrawn(request.getId(), caseId, lawyer.id());
    }

    public List<AccessRequestDto> listForCase(UUID caseId) {
        return requestRepository.listForCase(caseId).stream().map(this::toDto).toList();
    }

    public List<AccessRequestDto> listForLawyer(Principal lawyer) {
        return requestRepository.listForLawyer(lawyer.id()).stream().map(this::toDto).toList();
    }

    public Optional<AccessRequestDto> findById(UUID requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        return requestRepository.findByIdOptional(requestId).map(this::toDto);
    }

    /** When the latest rejection still blocks a new request, the instant the block ends. */
    Optional<OffsetDateTime> nextAllowedSubmission(UUID caseId, UUID lawyerId) {
        if (resubmitCooldown.isZero() || resubmitCooldown.isNegative()) {
            return Optional.empty();
        }
        return requestRepository
                .findLatestRejected(caseId, lawyerId)
                .map(CaseAccessRequestEntity::getReviewedAt)
                .map(reviewedAt -> reviewedAt.plus(resubmitCooldown))
                .filter(retryAt -> retryAt.isAfter(OffsetDateTime.now()));
    }

    private void requireLawyer(Principal principal) {
        if (principal == null || !principal.active() || !principal.hasRole(UserRole.LAWYER)) {
            throw new AccessRequestException(
                    Reason.NOT_A_LAWYER, "Only active lawyers can request case access");
        }
    }

    private AccessRequestDto toDto(CaseAccessRequestEntity entity) {
        AccessRequestDto dto = new AccessRequestDto();
        dto.setId(entity.getId().toString());
        dto.setCaseId(entity.getCaseId().toString());
        dto.setLawyerId(entity.getLawyerId().toString());
        dto.setStatus(entity.getStatus());
        dto.setRequestedAt(entity.getRequestedAt().toString());
        if (entity.getReviewedAt() != null) {
            dto.setReviewedAt(entity.getReviewedAt().toString());
        }
        if (entity.getReviewedBy() != null) {
            dto.setReviewedBy(entity.getReviewedBy().toString());
        }
        return dto;
    }
}
