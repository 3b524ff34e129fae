package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.core.model.account.User;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.port.out.AuthMetrics;
import warden.spi.CredentialResolver;

@DisplayName("CredentialResolutionService")
@ExtendWith(MockitoExtension.class)
class CredentialResolutionServiceTest {

    @Mock
    private CredentialResolver tokens;

    @Mock
    private CredentialResolver apiKeys;

    @Mock
    private AuthMetrics metrics;

    private CredentialResolutionService service;

    private final User alice = User.builder("alice@example.com").build();

    @BeforeEach
    void setUp() {
        lenient().when(tokens.name()).thenReturn("bearer-token");
        lenient().when(tokens.priority()).thenReturn(200);
        lenient().when(apiKeys.name()).thenReturn("api-key");
        lenient().when(apiKeys.priority()).thenReturn(100);

        // Registration order is deliberately the reverse of priority order
        service = new CredentialResolutionService(List.of(apiKeys, tokens), metrics);
    }

    private AuthFailure failureOf(Uni<?> uni) {
        var ex = assertThrows(AuthException.class, () -> uni.await().atMost(Duration.ofSeconds(5)));
        return ex.failure();
    }

    @Nested
    @DisplayName("authenticate()")
    class AuthenticateTests {

        @Test
        @DisplayName("should return the first resolver's user without trying the next")
        void shouldStopAtFirstSuccess() {
            when(tokens.resolve("cred")).thenReturn(Uni.createFrom().item(alice));

            assertSame(alice, service.authenticate("cred").await().indefinitely());
            verify(apiKeys, never()).resolve(any());
            verify(metrics).recordResolution("bearer-token", true);
        }

        @Test
        @DisplayName("should fall through to the next resolver on a typed failure")
        void shouldFallThroughOnTypedFailure() {
            when(tokens.resolve("cred"))
                    .thenReturn(Uni.createFrom().failure(new AuthException(AuthFailure.INVALID_TOKEN)));
            when(apiKeys.resolve("cred")).thenReturn(Uni.createFrom().item(alice));

            assertSame(alice, service.authenticate("cred").await().indefinitely());
            verify(metrics).recordResolution("api-key", true);
        }

        @Test
        @DisplayName("should fall through when a resolver throws instead of failing the Uni")
        void shouldFallThroughOnThrownException() {
            when(tokens.resolve("cred")).thenThrow(new IllegalStateException("boom"));
            when(apiKeys.resolve("cred")).thenReturn(Uni.createFrom().item(alice));

            assertSame(alice, service.authenticate("cred").await().indefinitely());
        }

        @Test
        @DisplayName("should collapse every failure into INVALID_CREDENTIALS")
        void shouldCollapseFailures() {
            when(tokens.resolve("cred"))
                    .thenReturn(Uni.createFrom().failure(new AuthException(AuthFailure.REVOKED)));
            when(apiKeys.resolve("cred"))
                    .thenReturn(Uni.createFrom().failure(new AuthException(AuthFailure.INACTIVE_ACCOUNT)));

            assertEquals(AuthFailure.INVALID_CREDENTIALS, failureOf(service.authenticate("cred")));
            verify(metrics).recordResolution(null, false);
        }

        @Test
        @DisplayName("should collapse unexpected errors into INVALID_CREDENTIALS")
        void shouldCollapseUnexpectedErrors() {
            when(tokens.resolve("cred")).thenReturn(Uni.createFrom().failure(new RuntimeException("db down")));
            when(apiKeys.resolve("cred")).thenThrow(new IllegalArgumentException("bad input"));

            assertEquals(AuthFailure.INVALID_CREDENTIALS, failureOf(service.authenticate("cred")));
        }

        @Test
        @DisplayName("should fail a blank credential without consulting resolvers")
        void shouldFailBlankCredential() {
            assertEquals(AuthFailure.INVALID_CREDENTIALS, failureOf(service.authenticate(" ")));
            assertEquals(AuthFailure.INVALID_CREDENTIALS, failureOf(service.authenticate(null)));
            verify(tokens, never()).resolve(any());
            verify(apiKeys, never()).resolve(any());
        }

        @Test
        @DisplayName("should fail with INVALID_CREDENTIALS when no resolvers exist")
        void shouldFailWithoutResolvers() {
            var empty = new CredentialResolutionService(List.of(), metrics);

            assertEquals(AuthFailure.INVALID_CREDENTIALS, failureOf(empty.authenticate("cred")));
        }
    }

    @Nested
    @DisplayName("getActiveUser() and authenticateActive()")
    class ActiveUserTests {

        @Test
        @DisplayName("should pass an active user through")
        void shouldPassActiveUser() {
            assertSame(alice, service.getActiveUser(alice));
        }

        @Test
        @DisplayName("should reject an inactive user with INACTIVE_ACCOUNT")
        void shouldRejectInactiveUser() {
            var ex = assertThrows(AuthException.class, () -> service.getActiveUser(alice.withActive(false)));

            assertEquals(AuthFailure.INACTIVE_ACCOUNT, ex.failure());
        }

        @Test
        @DisplayName("should reject a resolved but inactive user")
        void shouldRejectResolvedInactiveUser() {
            when(tokens.resolve("cred")).thenReturn(Uni.createFrom().item(alice.withActive(false)));

            assertEquals(AuthFailure.INACTIVE_ACCOUNT, failureOf(service.authenticateActive("cred")));
        }
    }
}
