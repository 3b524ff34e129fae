package warden.core.service.account;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.RegistrationConfig;
import warden.core.model.account.StatusMessage;
import warden.core.model.account.User;
import warden.core.model.account.VerificationDispatch;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.CredentialIntegrityException;
import warden.core.model.auth.OneTimeCodePurpose;
import warden.core.model.auth.TokenPair;
import warden.core.port.in.AccountManagement;
import warden.core.port.in.TokenManagement;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.CollectionRepository;
import warden.core.port.out.CredentialCipher;
import warden.core.port.out.Notifier;
import warden.core.port.out.OneTimeCodeRepository;
import warden.core.port.out.UserRepository;

/**
 * Account lifecycle: registration, email verification, login, password change and
 * reset, and logout.
 *
 * <p>Token minting and revocation are delegated to {@link TokenManagement}; this service
 * only decides when a token may be handed out.
 */
@ApplicationScoped
public class AccountService implements AccountManagement {

    private static final Logger LOG = Logger.getLogger(AccountService.class);
    private static final Logger AUDIT = Logger.getLogger("warden.audit.auth");

    /** Code stored for accounts that never need verification. Never accepted. */
    static final String USED_CODE_SENTINEL = "-1";

    /** Expiry of the sentinel code. */
    static final Duration USED_CODE_SENTINEL_TTL = Duration.ofHours(366L * 10);

    static final String DEFAULT_COLLECTION_NAME = "Default";
    static final String DEFAULT_COLLECTION_DESCRIPTION = "Your default collection.";

    private final UserRepository users;
    private final CollectionRepository collections;
    private final OneTimeCodeRepository codes;
    private final Notifier notifier;
    private final TokenManagement tokens;
    private final CredentialCipher cipher;
    private final RegistrationConfig config;
    private final AuthMetrics metrics;

    @Inject
    public AccountService(
            UserRepository users,
            CollectionRepository collections,
            OneTimeCodeRepository codes,
            Notifier notifier,
            TokenManagement tokens,
            CredentialCipher cipher,
            RegistrationConfig config,
            AuthMetrics metrics) {
        this.users = users;
        this.collections = collections;
        this.codes = codes;
        this.notifier = notifier;
        this.tokens = tokens;
        this.cipher = cipher;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<User> register(String email, String password) {
        return register(email, password, false);
    }

    @Override
    public Uni<User> register(String email, String password, boolean superuser) {
        return Uni.createFrom()
                .item(() -> newUser(email, password, superuser))
                .flatMap(users::create)
                .call(this::provisionDefaultCollection)
                .flatMap(user -> config.requireEmailVerification()
                        ? startVerification(user)
                        : skipVerification(user))
                .invoke(user -> LOG.infof("Registered user %s (superuser=%s)", user.id(), user.superuser()));
    }

    private User newUser(String email, String password, boolean superuser) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email cannot be null or blank");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }

        return User.builder(email)
                .hashedPassword(cipher.hashPassword(password))
                .superuser(superuser)
                .build();
    }

    private Uni<Void> provisionDefaultCollection(User user) {
        return collections
                .createCollection(user.id(), DEFAULT_COLLECTION_NAME, DEFAULT_COLLECTION_DESCRIPTION)
                .call(collection -> collections.createGraph(
                        collection.id(), collection.name(), collection.description()))
                .flatMap(collection -> collections.addUserToCollection(user.id(), collection.id()));
    }

    private Uni<User> startVerification(User user) {
        var code = cipher.generateOneTimeCode();
        var expiresAt = Instant.now().plus(config.verificationCodeTtl());
        var pending = user.withVerificationCodeExpiry(expiresAt);

        return codes.store(user.id(), OneTimeCodePurpose.EMAIL_VERIFICATION, code, expiresAt)
                .call(() -> users.updateVerificationCodeExpiry(user.id(), expiresAt))
                .call(() -> notifier.sendVerificationEmail(user.email(), code, greeting(user)))
                .replaceWith(pending);
    }

    private Uni<User> skipVerification(User user) {
        var expiresAt = Instant.now().plus(USED_CODE_SENTINEL_TTL);
        var verified = user.markVerified();

        return codes.store(user.id(), OneTimeCodePurpose.EMAIL_VERIFICATION, USED_CODE_SENTINEL, expiresAt)
                .call(() -> users.markVerified(user.id()))
                .replaceWith(verified);
    }

    @Override
    public Uni<StatusMessage> verifyEmail(String email, String verificationCode) {
        if (verificationCode == null || USED_CODE_SENTINEL.equals(verificationCode)) {
            return Uni.createFrom().failure(new AuthException(AuthFailure.INVALID_CODE));
        }

        return codes.findUserId(OneTimeCodePurpose.EMAIL_VERIFICATION, verificationCode)
                .flatMap(userId -> userId.isEmpty()
                        ? Uni.createFrom().<User>failure(new AuthException(AuthFailure.INVALID_CODE))
                        : users.findById(userId.get())
                                .map(user -> user.filter(u -> u.email().equalsIgnoreCase(email))
                                        .orElseThrow(() -> new AuthException(AuthFailure.INVALID_CODE))))
                .call(user -> users.markVerified(user.id()))
                .call(user -> codes.removeByCode(OneTimeCodePurpose.EMAIL_VERIFICATION, verificationCode))
                .invoke(user -> AUDIT.infof("EMAIL_VERIFIED userId=%s", user.id()))
                .replaceWith(StatusMessage.of("Email verified successfully"));
    }

    @Override
    public Uni<VerificationDispatch> resendVerificationEmail(String email) {
        return users.findByEmail(email).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().<VerificationDispatch>failure(new AuthException(AuthFailure.USER_NOT_FOUND));
            }

            var user = found.get();
            var code = cipher.generateOneTimeCode();
            var expiresAt = Instant.now().plus(config.verificationCodeTtl());

            return codes.store(user.id(), OneTimeCodePurpose.EMAIL_VERIFICATION, code, expiresAt)
                    .call(() -> users.updateVerificationCodeExpiry(user.id(), expiresAt))
                    .call(() -> notifier.sendVerificationEmail(user.email(), code, greeting(user)))
                    .replaceWith(new VerificationDispatch(
                            user.email(),
                            expiresAt,
                            "Verification email sent successfully to " + user.email()));
        });
    }

    @Override
    public Uni<TokenPair> login(String email, String password) {
        if (email == null || password == null) {
            return loginFailed(email, AuthFailure.INVALID_CREDENTIALS);
        }

        return users.findByEmail(email).flatMap(found -> {
            if (found.isEmpty()) {
                return loginFailed(email, AuthFailure.INVALID_CREDENTIALS);
            }

            var user = found.get();
            if (user.hashedPassword() == null || user.hashedPassword().isBlank()) {
                return Uni.createFrom()
                        .<TokenPair>failure(new CredentialIntegrityException("No password hash stored for user " + user.id()));
            }
            if (!cipher.verifyPassword(password, user.hashedPassword())) {
                return loginFailed(email, AuthFailure.INVALID_CREDENTIALS);
            }
            if (config.requireEmailVerification() && !user.verified()) {
                return loginFailed(email, AuthFailure.EMAIL_NOT_VERIFIED);
            }
            if (!user.active()) {
                return loginFailed(email, AuthFailure.INACTIVE_ACCOUNT);
            }

            metrics.recordLogin(true, null);
            LOG.debugf("Login succeeded for user %s", user.id());
            return Uni.createFrom().item(tokens.issuePair(user.email()));
        });
    }

    private Uni<TokenPair> loginFailed(String email, AuthFailure failure) {
        metrics.recordLogin(false, failure);
        AUDIT.infof("LOGIN_FAILED email=%s reason=%s", email, failure);
        return Uni.createFrom().failure(new AuthException(failure));
    }

    @Override
    public Uni<TokenPair> refreshTokens(String refreshToken) {
        return tokens.refresh(refreshToken);
    }

    @Override
    public Uni<StatusMessage> changePassword(User user, String currentPassword, String newPassword) {
        return Uni.createFrom()
                .item(() -> cipher.verifyPassword(currentPassword, user.hashedPassword()))
                .flatMap(matches -> matches
                        ? users.updatePassword(user.id(), cipher.hashPassword(newPassword))
                        : Uni.createFrom().<Boolean>failure(new AuthException(AuthFailure.WRONG_PASSWORD)))
                .invoke(updated -> AUDIT.infof("PASSWORD_CHANGED userId=%s", user.id()))
                .replaceWith(StatusMessage.of("Password changed successfully"));
    }

    @Override
    public Uni<StatusMessage> requestPasswordReset(String email) {
        var generic = StatusMessage.of(StatusMessage.PASSWORD_RESET_REQUESTED);

        return users.findByEmail(email).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Password reset requested for unknown email");
                return Uni.createFrom().item(generic);
            }

            var user = found.get();
            var resetToken = cipher.generateOneTimeCode();
            var expiresAt = Instant.now().plus(config.resetTokenTtl());

            return codes.store(user.id(), OneTimeCodePurpose.PASSWORD_RESET, resetToken, expiresAt)
                    .call(() -> notifier.sendPasswordResetEmail(user.email(), resetToken, greeting(user)))
                    .invoke(() -> AUDIT.infof("PASSWORD_RESET_REQUESTED userId=%s", user.id()))
                    .replaceWith(generic);
        });
    }

    @Override
    public Uni<StatusMessage> confirmPasswordReset(String resetToken, String newPassword) {
        if (resetToken == null || resetToken.isBlank()) {
            return Uni.createFrom().failure(new AuthException(AuthFailure.INVALID_OR_EXPIRED_TOKEN));
        }

        return codes.findUserId(OneTimeCodePurpose.PASSWORD_RESET, resetToken)
                .map(userId -> userId.orElseThrow(() -> new AuthException(AuthFailure.INVALID_OR_EXPIRED_TOKEN)))
                .call(userId -> users.updatePassword(userId, cipher.hashPassword(newPassword)))
                .call(userId -> codes.removeForUser(OneTimeCodePurpose.PASSWORD_RESET, userId))
                .invoke(userId -> AUDIT.infof("PASSWORD_RESET_COMPLETED userId=%s", userId))
                .replaceWith(StatusMessage.of("Password reset successfully"));
    }

    @Override
    public Uni<StatusMessage> logout(String token) {
        return tokens.revoke(token).replaceWith(StatusMessage.of("Logged out successfully"));
    }

    @Override
    public Uni<Integer> cleanExpiredBlacklistedTokens() {
        return tokens.cleanExpiredBlacklistedTokens()
                .invoke(purged -> LOG.debugf("Purged %d expired blacklist entries", purged));
    }

    private static Map<String, String> greeting(User user) {
        return Map.of("first_name", user.firstName());
    }
}
