package warden.core.model.account;

import java.time.Instant;
import java.util.UUID;

/**
 * An account known to the directory.
 *
 * <p>Users are immutable; state transitions (verification, password change,
 * deactivation) produce a modified copy that the caller persists.
 *
 * @param id                     opaque identifier
 * @param email                  unique login email
 * @param hashedPassword         password hash as produced by the credential cipher
 * @param active                 whether the account may authenticate
 * @param verified               whether the email address has been confirmed
 * @param superuser              whether the account has administrative rights
 * @param name                   optional display name
 * @param verificationCodeExpiry expiry of the outstanding verification code, if any
 * @param createdAt              when the account was registered
 */
public record User(
        UUID id,
        String email,
        String hashedPassword,
        boolean active,
        boolean verified,
        boolean superuser,
        String name,
        Instant verificationCodeExpiry,
        Instant createdAt) {

    public User {
        if (id == null) {
            throw new IllegalArgumentException("User ID cannot be null");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("User email cannot be null or blank");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * First name used to personalise outbound email.
     *
     * <p>Falls back to the local part of the email address when no display name is set,
     * and to the whole address when the local part is empty.
     *
     * @return a non-blank greeting name
     */
    public String firstName() {
        if (name != null && !name.isBlank()) {
            return name.trim().split("\\s+")[0];
        }
        var at = email.indexOf('@');
        var localPart = at < 0 ? email : email.substring(0, at);
        return localPart.isBlank() ? email : localPart;
    }

    public User markVerified() {
        return new User(id, email, hashedPassword, active, true, superuser, name, verificationCodeExpiry, createdAt);
    }

    public User markSuperuser() {
        return new User(id, email, hashedPassword, active, verified, true, name, verificationCodeExpiry, createdAt);
    }

    public User withHashedPassword(String newHash) {
        return new User(id, email, newHash, active, verified, superuser, name, verificationCodeExpiry, createdAt);
    }

    public User withActive(boolean newActive) {
        return new User(id, email, hashedPassword, newActive, verified, superuser, name, verificationCodeExpiry, createdAt);
    }

    public User withVerificationCodeExpiry(Instant expiry) {
        return new User(id, email, hashedPassword, active, verified, superuser, name, expiry, createdAt);
    }

    public static Builder builder(String email) {
        return new Builder(email);
    }

    public static class Builder {
        private final String email;
        private UUID id = UUID.randomUUID();
        private String hashedPassword;
        private boolean active = true;
        private boolean verified;
        private boolean superuser;
        private String name;
        private Instant verificationCodeExpiry;
        private Instant createdAt = Instant.now();

        private Builder(String email) {
            this.email = email;
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder hashedPassword(String hashedPassword) {
            this.hashedPassword = hashedPassword;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder superuser(boolean superuser) {
            this.superuser = superuser;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder verificationCodeExpiry(Instant verificationCodeExpiry) {
            this.verificationCodeExpiry = verificationCodeExpiry;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public User build() {
            return new User(
                    id, email, hashedPassword, active, verified, superuser, name, verificationCodeExpiry, createdAt);
        }
    }
}
