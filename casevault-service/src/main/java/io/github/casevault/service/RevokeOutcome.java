package io.github.casevault.service;

public enum RevokeOutcome {
    REVOKED,
    NOT_GRANTED
}
