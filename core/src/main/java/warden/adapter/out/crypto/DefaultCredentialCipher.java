package warden.adapter.out.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import warden.core.model.auth.ApiKeyMaterial;
import warden.core.model.auth.TokenVerification;
import warden.core.port.out.CredentialCipher;

/**
 * Default credential cipher.
 *
 * <ul>
 *   <li>Tokens: HS256 JWS via jose4j. Claim validators are skipped so that an expired
 *       token still yields its payload; the caller judges expiry.</li>
 *   <li>Passwords: BCrypt via WildFly Elytron.</li>
 *   <li>API keys: {@code pk_} + 16 hex chars public ID, 32 random bytes base64url secret,
 *       SHA-256 hex hash compared in constant time.</li>
 *   <li>One-time codes: 32 alphanumeric characters from {@link SecureRandom}.</li>
 * </ul>
 */
@ApplicationScoped
public class DefaultCredentialCipher implements CredentialCipher {

    private static final Logger LOG = Logger.getLogger(DefaultCredentialCipher.class);

    private static final int MIN_SECRET_BYTES = 32;
    private static final String PUBLIC_ID_PREFIX = "pk_";
    private static final int PUBLIC_ID_BYTES = 8;
    private static final int SECRET_BYTES = 32;
    private static final int ONE_TIME_CODE_LENGTH = 32;
    private static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final CipherConfig config;
    private final SecureRandom random = new SecureRandom();

    private HmacKey signingKey;
    private JwtConsumer consumer;
    private BcryptPasswordHasher passwords;

    @Inject
    public DefaultCredentialCipher(CipherConfig config) {
        this.config = config;
    }

    @PostConstruct
    void init() {
        var secret = config.signingSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "warden.crypto.signing-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }

        signingKey = new HmacKey(secret);
        consumer = new JwtConsumerBuilder()
                .setSkipAllValidators()
                .setVerificationKey(signingKey)
                .setJwsAlgorithmConstraints(
                        new AlgorithmConstraints(ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256))
                .build();
        passwords = new BcryptPasswordHasher(config.bcryptCost(), random);

        LOG.infof("Credential cipher initialized (issuer=%s, bcryptCost=%d)", config.issuer(), config.bcryptCost());
    }

    @Override
    public String signToken(Map<String, Object> payload, Instant expiresAt) {
        var claims = new JwtClaims();
        payload.forEach(claims::setClaim);
        claims.setIssuer(config.issuer());
        claims.setIssuedAtToNow();
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));

        var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(signingKey);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);

        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }

    @Override
    public TokenVerification verifyToken(String token) {
        try {
            var claims = consumer.processToClaims(token);
            if (!config.issuer().equals(claims.getClaimValue("iss"))) {
                return new TokenVerification.Rejected("Unexpected issuer");
            }
            return new TokenVerification.Verified(claims.getClaimsMap());
        } catch (InvalidJwtException e) {
            LOG.debugv("Token rejected: {0}", e.getMessage());
            return new TokenVerification.Rejected(e.getMessage());
        }
    }

    @Override
    public String hashPassword(String plainPassword) {
        return passwords.hash(plainPassword);
    }

    @Override
    public boolean verifyPassword(String plainPassword, String hashedPassword) {
        return passwords.verify(plainPassword, hashedPassword);
    }

    @Override
    public ApiKeyMaterial generateApiKey() {
        var id = new byte[PUBLIC_ID_BYTES];
        random.nextBytes(id);
        var secret = new byte[SECRET_BYTES];
        random.nextBytes(secret);

        return new ApiKeyMaterial(
                PUBLIC_ID_PREFIX + HexFormat.of().formatHex(id),
                Base64.getUrlEncoder().withoutPadding().encodeToString(secret));
    }

    @Override
    public String hashApiKey(String rawSecret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(rawSecret.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in Java
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    @Override
    public boolean verifyApiKey(String rawSecret, String keyHash) {
        if (rawSecret == null || keyHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                hashApiKey(rawSecret).getBytes(StandardCharsets.UTF_8), keyHash.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String generateOneTimeCode() {
        var code = new StringBuilder(ONE_TIME_CODE_LENGTH);
        for (int i = 0; i < ONE_TIME_CODE_LENGTH; i++) {
            code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return code.toString();
    }
}
