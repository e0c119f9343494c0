package io.github.casevault.service;

import io.github.casevault.persistence.entity.SessionEntity;
import io.github.casevault.persistence.entity.UserEntity;
import io.github.casevault.persistence.repo.SessionRepository;
import io.github.casevault.persistence.repo.UserRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Opaque session tokens backed by the {@code user_sessions} table. Only the SHA-256 digest of a
 * token is stored, so a leaked table does not leak usable credentials. Every lookup goes to the
 * database and any instance can resolve any session.
 */
@ApplicationScoped
public class SessionService {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private static final int TOKEN_BYTES = 32;

    @ConfigProperty(name = "casevault.sessions.ttl", defaultValue = "P7D")
    Duration ttl;

    @Inject SessionRepository sessionRepository;

    @Inject UserRepository userRepository;

    private final SecureRandom random = new SecureRandom();

    @Transactional
    public IssuedSession open(UserEntity user) {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        SessionEntity session = new SessionEntity();
        session.setId(digest(token));
        session.setUserId(user.getId());
        session.setCreatedAt(OffsetDateTime.now());
        session.setExpiresAt(session.getCreatedAt().plus(ttl));
        sessionRepository.persist(session);

        LOG.infof(
                "Opened session for user %s, expires at %s", user.getId(), session.getExpiresAt());
        return new IssuedSession(token, session.getExpiresAt(), user);
    }

    /** The owner of an unexpired session, active or not. */
    public Optional<UserEntity> findSessionUser(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return sessionRepository
                .findActive(digest(token), OffsetDateTime.now())
                .flatMap(session -> userRepository.findByIdOptional(session.getUserId()));
    }

    @Transactional
    public boolean close(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return sessionRepository.deleteById(digest(token));
    }

    @Transactional
    public long closeAllForUser(UUID userId) {
        long deleted = sessionRepository.deleteForUser(userId);
        if (deleted > 0) {
            LOG.infof("Closed %d sessions of user %s", deleted, userId);
        }
        return deleted;
    }

    @Transactional
    public long purgeExpired() {
        return sessionRepository.deleteExpired(OffsetDateTime.now());
    }

    static String digest(String token) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of()
                    .formatHex(sha256.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
