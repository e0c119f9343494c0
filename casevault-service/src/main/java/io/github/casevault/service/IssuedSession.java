package io.github.casevault.service;

import io.github.casevault.persistence.entity.UserEntity;
import java.time.OffsetDateTime;

/** A freshly opened session. {@code token} is the only copy of the raw credential. */
public record IssuedSession(String token, OffsetDateTime expiresAt, UserEntity user) {}
