package io.github.casevault.security;

import io.github.casevault.model.ReviewDecision;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.UUID;
import org.jboss.logging.Logger;

@ApplicationScoped
public class AccessAuditLogger {

    private static final Logger AUDIT_LOG = Logger.getLogger("io.github.casevault.access.audit");

    /** Log a grant written for a lawyer. */
    public void logGrant(UUID caseId, UUID lawyerId) {
        AUDIT_LOG.infof("ACCESS_CHANGE action=grant case=%s lawyer=%s", caseId, lawyerId);
    }

    /** Log a grant removal. */
    public void logRevoke(UUID caseId, UUID lawyerId) {
        AUDIT_LOG.infof("ACCESS_CHANGE action=revoke case=%s lawyer=%s", caseId, lawyerId);
    }

    public void logRequestSubmitted(UUID requestId, UUID caseId, UUID lawyerId) {
        AUDIT_LOG.infof(
                "ACCESS_REQUEST action=submit request=%s case=%s lawyer=%s",
                requestId, caseId, lawyerId);
    }

    public void logRequestWithdrawn(UUID requestId, UUID caseId, UUID lawyerId) {
        AUDIT_LOG.infof(
                "ACCESS_REQUEST action=withdraw request=%s case=%s lawyer=%s",
                requestId, caseId, lawyerId);
    }

    /** Log a completed review. */
    public void logReview(
            UUID requestId, UUID caseId, UUID lawyerId, UUID reviewerId, ReviewDecision decision) {
        AUDIT_LOG.infof(
                "ACCESS_REQUEST action=review request=%s case=%s lawyer=%s reviewer=%s"
                        + " decision=%s",
                requestId, caseId, lawyerId, reviewerId, decision);
    }
}
