package io.github.casevault.service;

import io.github.casevault.api.dto.UserDto;
import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.entity.UserEntity;
import io.github.casevault.persistence.repo.UserRepository;
import io.github.casevault.store.ResourceConflictException;
import io.github.casevault.store.ResourceNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/** Account registration, password login and the administrative activation switch. */
@ApplicationScoped
public class UserService {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    @Inject UserRepository userRepository;

    @Inject PasswordService passwordService;

    @Inject SessionService sessionService;

    /**
     * Create a self-registered account. Administrators are never created this way.
     *
     * @throws IllegalArgumentException if {@code role} is ADMIN
     * @throws ResourceConflictException if the email is already registered
     */
    @Transactional
    public UserEntity register(
            String email, String password, String firstName, String lastName, UserRole role) {
        if (role != UserRole.CLIENT && role != UserRole.LAWYER) {
            throw new IllegalArgumentException("role must be CLIENT or LAWYER");
        }
        return create(email, password, firstName, lastName, role);
    }

    @Transactional
    public UserEntity create(
            String email, String password, String firstName, String lastName, UserRole role) {
        String normalized = normalizeEmail(email);
        if (userRepository.findByEmail(normalized).isPresent()) {
            throw new ResourceConflictException("user", normalized, "Email already registered");
        }
        UserEntity user = new UserEntity();
        user.setEmail(normalized);
        user.setPasswordHash(passwordService.hash(password));
        user.setFirstName(firstName.trim());
        user.setLastName(lastName.trim());
        user.setRole(role);
        user.setActive(true);
        userRepository.persist(user);
        LOG.infof("Registered %s user %s", role, user.getId());
        return user;
    }

    /**
     * Check a password login. Unknown emails, wrong passwords and deactivated accounts all
     * produce an empty result.
     */
    public Optional<UserEntity> authenticate(String email, String password) {
        Optional<UserEntity> user = userRepository.findByEmail(email);
        if (user.isEmpty() || !passwordService.verify(password, user.get().getPasswordHash())) {
            LOG.infof("Failed login for %s", email);
            return Optional.empty();
        }
        if (!user.get().isActive()) {
            LOG.infof("Login refused for deactivated user %s", user.get().getId());
            return Optional.empty();
        }
        return user;
    }

    public Optional<UserEntity> findById(UUID userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userRepository.findByIdOptional(userId);
    }

    /**
     * Activate or deactivate an account. Deactivation also closes every session of the user, so
     * their credentials stop resolving immediately.
     */
    /** Active lawyers an owner can choose from when granting access. */
    public List<UserEntity> listAvailableLawyers() {
        return userRepository.listActiveByRole(UserRole.LAWYER);
    }

    @Transactional
    public UserEntity setActive(UUID userId, boolean active) {
        UserEntity user =
                userRepository
                        .findByIdOptional(userId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "user", String.valueOf(userId)));
        if (user.isActive() != active) {
            user.setActive(active);
            LOG.infof("User %s is now %s", userId, active ? "active" : "inactive");
        }
        if (!active) {
            sessionService.closeAllForUser(userId);
        }
        return user;
    }

    public static UserDto toDto(UserEntity user) {
        UserDto dto = new UserDto();
        dto.setId(user.getId().toString());
        dto.setEmail(user.getEmail());
        dto.setFirstName(user.getFirstName());
        dto.setLastName(user.getLastName());
        dto.setRole(user.getRole());
        dto.setActive(user.isActive());
        if (user.getCreatedAt() != null) {
            dto.setCreatedAt(user.getCreatedAt().toString());
        }
        return dto;
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        return email.trim().toLowerCase();
    }
}
