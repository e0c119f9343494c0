package io.github.casevault.service;

/** Result of {@link CaseAccessService#grant}. */
public enum GrantOutcome {
    GRANTED,
    ALREADY_GRANTED,
    USER_NOT_FOUND,
    WRONG_ROLE,
    INACTIVE,
    CASE_NOT_FOUND;

    public boolean isError() {
        return this != GRANTED && this != ALREADY_GRANTED;
    }
}
