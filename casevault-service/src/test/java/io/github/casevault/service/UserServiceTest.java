package io.github.casevault.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.entity.UserEntity;
import io.github.casevault.persistence.repo.UserRepository;
import io.github.casevault.store.ResourceConflictException;
import io.github.casevault.store.ResourceNotFoundException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UserServiceTest {

    private UserRepository userRepository;
    private PasswordService passwordService;
    private SessionService sessionService;
    private UserService service;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        passwordService = mock(PasswordService.class);
        sessionService = mock(SessionService.class);
        service = new UserService();
        service.userRepository = userRepository;
        service.passwordService = passwordService;
        service.sessionService = sessionService;
        when(passwordService.hash(any())).thenReturn("$2a$10$hash");
    }

    private UserEntity stored(boolean active) {
        UserEntity user = new UserEntity();
        user.setId(UUID.randomUUID());
        user.setEmail("someone@example.com");
        user.setPasswordHash("$2a$10$hash");
        user.setRole(UserRole.LAWYER);
        user.setActive(active);
        when(userRepository.findByEmail("someone@example.com")).thenReturn(Optional.of(user));
        when(userRepository.findByIdOptional(user.getId())).thenReturn(Optional.of(user));
        return user;
    }

    @Test
    void register_normalizes_email_and_hashes_password() {
        UserEntity user =
                service.register(
                        " Someone@Example.COM ", "pw-123456", "Ann", "Lee", UserRole.CLIENT);

        assertEquals("someone@example.com", user.getEmail());
        assertEquals("$2a$10$hash", user.getPasswordHash());
        assertTrue(user.isActive());
        verify(userRepository).persist(user);
    }

    @Test
    void administrators_cannot_self_register() {
        assertThrows(
                IllegalArgumentException.class,
                () -> service.register("a@example.com", "pw-123456", "A", "B", UserRole.ADMIN));
        verify(userRepository, never()).persist(any(UserEntity.class));
    }

    @Test
    void duplicate_email_is_a_conflict() {
        stored(true);

        assertThrows(
                ResourceConflictException.class,
                () ->
                        service.register(
                                "someone@example.com", "pw-123456", "A", "B", UserRole.LAWYER));
    }

    @Test
    void authenticate_checks_password_and_activation() {
        stored(true);
        when(passwordService.verify("right", "$2a$10$hash")).thenReturn(true);

        assertTrue(service.authenticate("someone@example.com", "right").isPresent());
        assertTrue(service.authenticate("someone@example.com", "wrong").isEmpty());
        assertTrue(service.authenticate("nobody@example.com", "right").isEmpty());
    }

    @Test
    void deactivated_user_cannot_log_in() {
        stored(false);
        when(passwordService.verify("right", "$2a$10$hash")).thenReturn(true);

        assertTrue(service.authenticate("someone@example.com", "right").isEmpty());
    }

    @Test
    void deactivation_closes_sessions() {
        UserEntity user = stored(true);

        UserEntity updated = service.setActive(user.getId(), false);

        assertFalse(updated.isActive());
        verify(sessionService).closeAllForUser(user.getId());
    }

    @Test
    void reactivation_keeps_sessions_untouched() {
        UserEntity user = stored(false);

        assertTrue(service.setActive(user.getId(), true).isActive());
        verify(sessionService, never()).closeAllForUser(any());
    }

    @Test
    void unknown_user_cannot_be_updated() {
        UUID missing = UUID.randomUUID();
        when(userRepository.findByIdOptional(missing)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.setActive(missing, false));
    }

    @Test
    void dto_copies_account_fields() {
        UserEntity user = stored(true);

        var dto = UserService.toDto(user);

        assertEquals(user.getId().toString(), dto.getId());
        assertEquals("someone@example.com", dto.getEmail());
        assertEquals(UserRole.LAWYER, dto.getRole());
        assertTrue(dto.isActive());
    }
}
