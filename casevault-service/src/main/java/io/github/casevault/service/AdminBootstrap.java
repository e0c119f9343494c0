package io.github.casevault.service;

import io.github.casevault.model.UserRole;
import io.github.casevault.persistence.repo.UserRepository;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Creates the first administrator at startup when {@code casevault.admin.bootstrap-email} and
 * {@code casevault.admin.bootstrap-password} are both set and no account uses that email yet.
 */
@ApplicationScoped
public class AdminBootstrap {

    private static final Logger LOG = Logger.getLogger(AdminBootstrap.class);

    @ConfigProperty(name = "casevault.admin.bootstrap-email")
    Optional<String> email;

    @ConfigProperty(name = "casevault.admin.bootstrap-password")
    Optional<String> password;

    @Inject UserRepository userRepository;

    @Inject UserService userService;

    @Startup
    @Transactional
    void onStartup() {
        if (email.isEmpty() || password.isEmpty()) {
            return;
        }
        if (userRepository.findByEmail(email.get()).isPresent()) {
            LOG.debugf("Bootstrap administrator %s already exists", email.get());
            return;
        }
        userService.create(email.get(), password.get(), "System", "Administrator", UserRole.ADMIN);
        LOG.infof("Created bootstrap administrator %s", email.get());
    }
}
