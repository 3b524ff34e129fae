package warden.adapter.out.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.CredentialIntegrityException;
import warden.core.model.auth.TokenVerification;
import warden.support.TestConfigs;

@DisplayName("DefaultCredentialCipher")
class DefaultCredentialCipherTest {

    private DefaultCredentialCipher cipher;

    @BeforeEach
    void setUp() {
        cipher = TestCiphers.create();
    }

    @Nested
    @DisplayName("tokens")
    class TokenTests {

        @Test
        @DisplayName("should round-trip the payload and stamp issuer and expiry")
        void shouldCarryPayload() {
            var expiresAt = Instant.now().plus(Duration.ofHours(1));

            var token = cipher.signToken(Map.of("sub", "a@b.com", "token_type", "access"), expiresAt);
            var verification = cipher.verifyToken(token);

            var verified = assertInstanceOf(TokenVerification.Verified.class, verification);
            assertEquals("a@b.com", verified.payload().get("sub"));
            assertEquals("warden", verified.payload().get("iss"));
            assertEquals(expiresAt.getEpochSecond(), ((Number) verified.payload().get("exp")).longValue());
        }

        @Test
        @DisplayName("should return the payload of an expired token")
        void shouldNotJudgeExpiry() {
            var token = cipher.signToken(Map.of("sub", "a@b.com"), Instant.now().minus(Duration.ofDays(1)));

            assertInstanceOf(TokenVerification.Verified.class, cipher.verifyToken(token));
        }

        @Test
        @DisplayName("should reject a tampered token")
        void shouldRejectTamperedToken() {
            var token = cipher.signToken(Map.of("sub", "a@b.com"), Instant.now().plus(Duration.ofHours(1)));
            var parts = token.split("\\.");
            var tampered = parts[0] + "." + parts[1] + "x." + parts[2];

            assertInstanceOf(TokenVerification.Rejected.class, cipher.verifyToken(tampered));
        }

        @Test
        @DisplayName("should reject a token from another issuer")
        void shouldRejectForeignIssuer() {
            var other = TestCiphers.create(TestConfigs.cipher(TestConfigs.SIGNING_SECRET, "someone-else"));
            var token = other.signToken(Map.of("sub", "a@b.com"), Instant.now().plus(Duration.ofHours(1)));

            assertInstanceOf(TokenVerification.Rejected.class, cipher.verifyToken(token));
        }

        @Test
        @DisplayName("should reject garbage")
        void shouldRejectGarbage() {
            assertInstanceOf(TokenVerification.Rejected.class, cipher.verifyToken("definitely.not.a-jwt"));
        }

        @Test
        @DisplayName("should refuse a signing secret shorter than 32 bytes")
        void shouldRefuseShortSecret() {
            assertThrows(IllegalStateException.class, () -> TestCiphers.create(TestConfigs.cipher("short", "warden")));
        }
    }

    @Nested
    @DisplayName("passwords")
    class PasswordTests {

        @Test
        @DisplayName("should verify the right password only")
        void shouldVerifyPassword() {
            var hash = cipher.hashPassword("s3cret");

            assertTrue(cipher.verifyPassword("s3cret", hash));
            assertFalse(cipher.verifyPassword("S3cret", hash));
        }

        @Test
        @DisplayName("should salt every hash")
        void shouldSaltHashes() {
            assertNotEquals(cipher.hashPassword("same"), cipher.hashPassword("same"));
        }

        @Test
        @DisplayName("should raise an integrity error for an undecodable hash")
        void shouldRaiseIntegrityError() {
            assertThrows(CredentialIntegrityException.class, () -> cipher.verifyPassword("pw", "plaintext"));
            assertThrows(CredentialIntegrityException.class, () -> cipher.verifyPassword("pw", ""));
        }
    }

    @Nested
    @DisplayName("API keys and codes")
    class KeyTests {

        @Test
        @DisplayName("should generate public IDs without separators")
        void shouldGenerateSeparatorFreeIds() {
            var material = cipher.generateApiKey();

            assertTrue(material.publicId().startsWith("pk_"));
            assertFalse(material.publicId().contains("."));
            assertFalse(material.rawSecret().contains("."));
        }

        @Test
        @DisplayName("should verify a secret against its hash")
        void shouldVerifySecret() {
            var material = cipher.generateApiKey();
            var hash = cipher.hashApiKey(material.rawSecret());

            assertTrue(cipher.verifyApiKey(material.rawSecret(), hash));
            assertFalse(cipher.verifyApiKey(material.rawSecret() + "x", hash));
            assertFalse(cipher.verifyApiKey(null, hash));
        }

        @Test
        @DisplayName("should generate distinct alphanumeric one-time codes")
        void shouldGenerateOneTimeCodes() {
            var codes = new HashSet<String>();
            for (int i = 0; i < 50; i++) {
                var code = cipher.generateOneTimeCode();
                assertEquals(32, code.length());
                assertTrue(code.chars().allMatch(Character::isLetterOrDigit));
                codes.add(code);
            }
            assertEquals(50, codes.size());
        }
    }
}
