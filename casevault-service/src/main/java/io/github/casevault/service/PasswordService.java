package io.github.casevault.service;

import jakarta.enterprise.context.ApplicationScoped;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.InvalidKeySpecException;
import org.jboss.logging.Logger;
import org.wildfly.security.password.Password;
import org.wildfly.security.password.PasswordFactory;
import org.wildfly.security.password.WildFlyElytronPasswordProvider;
import org.wildfly.security.password.interfaces.BCryptPassword;
import org.wildfly.security.password.spec.EncryptablePasswordSpec;
import org.wildfly.security.password.spec.IteratedSaltedPasswordAlgorithmSpec;
import org.wildfly.security.password.util.ModularCrypt;

/** BCrypt hashing of account passwords through the WildFly Elytron password provider. */
@ApplicationScoped
public class PasswordService {

    private static final Logger LOG = Logger.getLogger(PasswordService.class);

    private static final int BCRYPT_COST = 10;
    private static final int SALT_SIZE = 16;

    static {
        Security.addProvider(WildFlyElytronPasswordProvider.getInstance());
    }

    private final SecureRandom random = new SecureRandom();

    /**
     * Hash a password with a fresh salt.
     *
     * @return the hash in Modular Crypt Format
     */
    public String hash(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        byte[] salt = new byte[SALT_SIZE];
        random.nextBytes(salt);
        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCryptPassword.ALGORITHM_BCRYPT);
            Password password =
                    factory.generatePassword(
                            new EncryptablePasswordSpec(
                                    plainPassword.toCharArray(),
                                    new IteratedSaltedPasswordAlgorithmSpec(BCRYPT_COST, salt)));
            return ModularCrypt.encodeAsString(password);
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("Failed to hash password", e);
        }
    }

    /** Returns {@code false} for a wrong password and for a hash that cannot be decoded. */
    public boolean verify(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }
        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCryptPassword.ALGORITHM_BCRYPT);
            Password stored = factory.translate(ModularCrypt.decode(passwordHash));
            return factory.verify(stored, plainPassword.toCharArray());
        } catch (NoSuchAlgorithmException | InvalidKeyException | InvalidKeySpecException e) {
            LOG.warnf("Stored password hash could not be verified: %s", e.getMessage());
            return false;
        }
    }
}
