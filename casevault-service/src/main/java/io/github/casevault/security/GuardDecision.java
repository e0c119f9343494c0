package io.github.casevault.security;

import java.util.Optional;

/** Outcome of a {@link RequestGuard} check. */
public final class GuardDecision {

    public enum Outcome {
        ALLOWED,
        UNAUTHENTICATED,
        FORBIDDEN
    }

    private static final GuardDecision UNAUTHENTICATED =
            new GuardDecision(Outcome.UNAUTHENTICATED, null);

    private final Outcome outcome;
    private final Principal principal;

    private GuardDecision(Outcome outcome, Principal principal) {
        this.outcome = outcome;
        this.principal = principal;
    }

    public static GuardDecision allowed(Principal principal) {
        return new GuardDecision(Outcome.ALLOWED, principal);
    }

    public static GuardDecision unauthenticated() {
        return UNAUTHENTICATED;
    }

    public static GuardDecision forbidden(Principal principal) {
        return new GuardDecision(Outcome.FORBIDDEN, principal);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }

    /** The resolved principal; present for ALLOWED and FORBIDDEN decisions. */
    Optional<Principal> getPrincipal() {
        return Optional.ofNullable(principal);
    }

    /**
     * The principal of an ALLOWED decision.
     *
     * @throws IllegalStateException if the decision is not ALLOWED
     */
    public Principal principal() {
        if (!isAllowed()) {
            throw new IllegalStateException("No principal for a " + outcome + " decision");
        }
        return principal;
    }

    @Override
    public String toString() {
        return "GuardDecision{outcome=" + outcome + ", principal=" + principal + "}";
    }
}
