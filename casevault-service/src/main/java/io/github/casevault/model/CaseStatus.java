package io.github.casevault.model;

public enum CaseStatus {
    OPEN,
    CLOSED,
    ARCHIVED
}
