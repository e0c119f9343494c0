package io.github.casevault.persistence.repo;

import io.github.casevault.persistence.entity.SessionEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class SessionRepository implements PanacheRepositoryBase<SessionEntity, String> {

    public Optional<SessionEntity> findActive(String sessionId, OffsetDateTime now) {
        return find("id = ?1 AND expiresAt > ?2", sessionId, now).firstResultOptional();
    }

    public long deleteExpired(OffsetDateTime now) {
        return delete("expiresAt <= ?1", now);
    }

    public long deleteForUser(UUID userId) {
        return delete("userId = ?1", userId);
    }
}
