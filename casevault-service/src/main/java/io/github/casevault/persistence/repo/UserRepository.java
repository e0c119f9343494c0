package io.github.casevault.persistence.repo;

import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.entity.UserEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class UserRepository implements PanacheRepositoryBase<UserEntity, UUID> {

    public Optional<UserEntity> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return find("email = ?1", email.trim().toLowerCase()).firstResultOptional();
    }

    public List<UserEntity> listActiveByRole(UserRole role) {
        return list("role = ?1 AND active = true ORDER BY lastName, firstName", role);
    }
}
