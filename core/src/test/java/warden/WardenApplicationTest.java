package warden;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.port.in.AccountManagement;
import warden.core.port.in.ApiKeyManagement;
import warden.core.port.in.CredentialResolution;
import warden.core.port.out.UserRepository;

/**
 * Exercises the wired application: storage discovery, cipher, resolvers and bootstrap.
 */
@QuarkusTest
@TestProfile(WardenApplicationTest.BootstrapEnabledProfile.class)
@DisplayName("Warden application")
public class WardenApplicationTest {

    static final String ADMIN_EMAIL = "root@warden.test";
    static final String ADMIN_PASSWORD = "integration-admin-password";

    @Inject
    AccountManagement accounts;

    @Inject
    ApiKeyManagement apiKeys;

    @Inject
    CredentialResolution resolution;

    @Inject
    UserRepository users;

    public static class BootstrapEnabledProfile implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                    "warden.bootstrap.enabled", "true",
                    "warden.bootstrap.admin-email", ADMIN_EMAIL,
                    "warden.bootstrap.admin-password", ADMIN_PASSWORD,
                    "warden.storage.provider", "memory",
                    "warden.storage.memory.initial-capacity", "64");
        }
    }

    private static <T> T await(Uni<T> uni) {
        return uni.await().atMost(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("should seed the admin on startup")
    void shouldSeedAdmin() {
        var admin = await(users.findByEmail(ADMIN_EMAIL)).orElseThrow();

        assertTrue(admin.superuser());
        assertEquals(ADMIN_EMAIL, await(resolution.authenticate(
                        await(accounts.login(ADMIN_EMAIL, ADMIN_PASSWORD)).accessToken().token()))
                .email());
    }

    @Test
    @DisplayName("should resolve both tokens and API keys for a registered user")
    void shouldResolveTokensAndApiKeys() {
        var user = await(accounts.register("carol@warden.test", "carol-password"));
        var pair = await(accounts.login("carol@warden.test", "carol-password"));
        var key = await(apiKeys.issue(user.id(), "cli"));

        assertEquals(user.id(), await(resolution.authenticateActive(pair.accessToken().token())).id());
        assertEquals(user.id(), await(resolution.authenticateActive(key.compositeKey())).id());
        assertEquals(user.id(), await(resolution.authenticateActive("Bearer " + key.compositeKey())).id());
    }

    @Test
    @DisplayName("should collapse every failed credential into INVALID_CREDENTIALS")
    void shouldCollapseFailures() {
        var user = await(accounts.register("dave@warden.test", "dave-password"));
        var pair = await(accounts.login("dave@warden.test", "dave-password"));
        await(accounts.logout(pair.accessToken().token()));

        for (var credential : new String[] {"garbage", "pk_nope.secret", pair.accessToken().token()}) {
            var ex = assertThrows(AuthException.class, () -> await(resolution.authenticate(credential)));
            assertEquals(AuthFailure.INVALID_CREDENTIALS, ex.failure());
        }
        assertEquals(user.id(), await(resolution.authenticate(pair.refreshToken().token())).id());
    }
}
