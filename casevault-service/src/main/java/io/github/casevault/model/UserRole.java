package io.github.casevault.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Principal kinds known to the platform. ADMIN is persisted like the other roles; every
 * authorization decision switches over this enum exhaustively.
 */
public enum UserRole {
    CLIENT,
    LAWYER,
    ADMIN;

    @JsonCreator
    public static UserRole fromString(String value) {
        if (value == null) {
            return null;
        }
        return UserRole.valueOf(value.trim().toUpperCase());
    }
}
