package warden.core.service.account;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.crypto.DefaultCredentialCipher;
import warden.adapter.out.crypto.TestCiphers;
import warden.adapter.out.storage.memory.InMemoryDirectoryStore;
import warden.config.BootstrapConfig;
import warden.core.port.in.BootstrapManagement.BootstrapException;
import warden.core.port.out.AuthMetrics;
import warden.core.service.auth.TestTokenServices;
import warden.support.RecordingNotifier;
import warden.support.TestConfigs;

@DisplayName("AdminBootstrapService")
class AdminBootstrapServiceTest {

    private static final String ADMIN_EMAIL = "admin@example.com";
    private static final String ADMIN_PASSWORD = "change_me_immediately";

    private InMemoryDirectoryStore store;
    private AccountService accounts;
    private DefaultCredentialCipher cipher;

    @BeforeEach
    void setUp() {
        store = new InMemoryDirectoryStore();
        cipher = TestCiphers.create();
        accounts = new AccountService(
                store.users(),
                store.collections(),
                store.oneTimeCodes(),
                new RecordingNotifier(),
                TestTokenServices.create(cipher, store.blacklist(), TestConfigs.tokens(), TestConfigs.blacklist(true)),
                cipher,
                TestConfigs.registration(true),
                AuthMetrics.NOOP);
    }

    private AdminBootstrapService createService(BootstrapConfig config) {
        return new AdminBootstrapService(config, store.users(), accounts);
    }

    @Nested
    @DisplayName("bootstrap()")
    class BootstrapTests {

        @Test
        @DisplayName("should create the admin as a verified superuser")
        void shouldCreateAdmin() {
            var service = createService(TestConfigs.bootstrap(true, ADMIN_EMAIL, ADMIN_PASSWORD));

            var created = service.bootstrap().await().atMost(Duration.ofSeconds(5));

            assertTrue(created.isPresent());
            var stored = store.users().findByEmail(ADMIN_EMAIL).await().indefinitely().orElseThrow();
            assertTrue(stored.superuser());
            assertTrue(stored.verified());
            assertTrue(cipher.verifyPassword(ADMIN_PASSWORD, stored.hashedPassword()));
        }

        @Test
        @DisplayName("should leave an existing account untouched")
        void shouldSkipExistingAccount() {
            accounts.register(ADMIN_EMAIL, "original-password").await().indefinitely();
            var service = createService(TestConfigs.bootstrap(true, ADMIN_EMAIL, ADMIN_PASSWORD));

            var created = service.bootstrap().await().indefinitely();

            assertTrue(created.isEmpty());
            var stored = store.users().findByEmail(ADMIN_EMAIL).await().indefinitely().orElseThrow();
            assertTrue(cipher.verifyPassword("original-password", stored.hashedPassword()));
        }

        @Test
        @DisplayName("should be safe to run twice")
        void shouldBeIdempotent() {
            var service = createService(TestConfigs.bootstrap(true, ADMIN_EMAIL, ADMIN_PASSWORD));

            service.bootstrap().await().indefinitely();

            assertTrue(service.bootstrap().await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should fail when the admin email is missing")
        void shouldFailWithoutEmail() {
            var service = createService(TestConfigs.bootstrap(true, null, ADMIN_PASSWORD));

            var ex = assertThrows(BootstrapException.class, service::bootstrap);
            assertTrue(ex.getMessage().contains("email"));
        }

        @Test
        @DisplayName("should fail when the admin password is blank")
        void shouldFailWithBlankPassword() {
            var service = createService(TestConfigs.bootstrap(true, ADMIN_EMAIL, " "));

            var ex = assertThrows(BootstrapException.class, service::bootstrap);
            assertTrue(ex.getMessage().contains("password"));
            assertEquals(0, store.users().findByEmail(ADMIN_EMAIL).await().indefinitely().stream().count());
        }
    }
}
