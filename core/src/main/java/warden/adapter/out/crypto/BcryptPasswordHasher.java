package warden.adapter.out.crypto;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.InvalidKeySpecException;

import org.wildfly.security.password.Password;
import org.wildfly.security.password.PasswordFactory;
import org.wildfly.security.password.WildFlyElytronPasswordProvider;
import org.wildfly.security.password.interfaces.BCryptPassword;
import org.wildfly.security.password.spec.EncryptablePasswordSpec;
import org.wildfly.security.password.spec.IteratedSaltedPasswordAlgorithmSpec;
import org.wildfly.security.password.util.ModularCrypt;

import warden.core.model.auth.CredentialIntegrityException;

/**
 * BCrypt hashing via WildFly Elytron. Hashes are stored in Modular Crypt Format.
 */
public class BcryptPasswordHasher {

    private static final String BCRYPT_ALGORITHM = BCryptPassword.ALGORITHM_BCRYPT;
    private static final int SALT_SIZE = 16; // BCrypt salts are always 128 bits

    static {
        Security.addProvider(WildFlyElytronPasswordProvider.getInstance());
    }

    private final int cost;
    private final SecureRandom random;

    public BcryptPasswordHasher(int cost, SecureRandom random) {
        if (cost < 4 || cost > 31) {
            throw new IllegalArgumentException("BCrypt cost must be between 4 and 31: " + cost);
        }
        this.cost = cost;
        this.random = random;
    }

    /**
     * Hash a password.
     *
     * @param plainPassword The plain text password
     * @return The hashed password in Modular Crypt Format
     */
    public String hash(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);

            byte[] salt = new byte[SALT_SIZE];
            random.nextBytes(salt);

            var spec = new IteratedSaltedPasswordAlgorithmSpec(cost, salt);
            Password password = factory.generatePassword(new EncryptablePasswordSpec(plainPassword.toCharArray(), spec));

            return ModularCrypt.encodeAsString(password);
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("Failed to hash password", e);
        }
    }

    /**
     * Verify a password against a stored hash.
     *
     * @throws CredentialIntegrityException if the stored hash is not a BCrypt hash
     */
    public boolean verify(String plainPassword, String passwordHash) {
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new CredentialIntegrityException("Stored password hash is empty");
        }
        if (plainPassword == null) {
            return false;
        }

        Password stored;
        try {
            stored = ModularCrypt.decode(passwordHash);
        } catch (InvalidKeySpecException e) {
            throw new CredentialIntegrityException("Stored password hash is not in Modular Crypt Format", e);
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);
            return factory.verify(factory.translate(stored), plainPassword.toCharArray());
        } catch (InvalidKeyException e) {
            throw new CredentialIntegrityException("Stored password hash is not a BCrypt hash", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("BCrypt algorithm not available", e);
        }
    }
}
