package io.github.casevault.service;

/**
 * Raised by {@link AccessRequestService} when a workflow step is refused. Being unchecked, it
 * also rolls back the surrounding transaction.
 */
public class AccessRequestException extends RuntimeException {

    public enum Reason {
        NOT_A_LAWYER,
        CASE_NOT_FOUND,
        REQUEST_NOT_FOUND,
        ALREADY_GRANTED,
        DUPLICATE_PENDING,
        RESUBMIT_COOLDOWN,
        NOT_REVIEWER,
        ALREADY_REVIEWED,
        GRANT_FAILED,
        NO_PENDING_REQUEST
    }

    private final Reason reason;
    private final GrantOutcome grantOutcome;

    public AccessRequestException(Reason reason, String message) {
        this(reason, null, message);
    }

    public AccessRequestException(Reason reason, GrantOutcome grantOutcome, String message) {
        super(message);
        this.reason = reason;
        this.grantOutcome = grantOutcome;
    }

    public Reason getReason() {
        return reason;
    }

    /** The refused grant outcome for {@link Reason#GRANT_FAILED}, otherwise {@code null}. */
    public GrantOutcome getGrantOutcome() {
        return grantOutcome;
    }
}
