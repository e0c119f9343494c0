package io.github.casevault.model;

/** Lifecycle of an access request. APPROVED and REJECTED are terminal. */
public enum AccessRequestStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
