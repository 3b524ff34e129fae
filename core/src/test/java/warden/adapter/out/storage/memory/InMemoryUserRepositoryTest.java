package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.account.User;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;

@DisplayName("InMemoryUserRepository")
class InMemoryUserRepositoryTest {

    private InMemoryUserRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUserRepository();
    }

    @Test
    @DisplayName("should find users by email regardless of case")
    void shouldFindByEmailIgnoringCase() {
        var user = repository.create(User.builder("Bob@Example.com").build()).await().indefinitely();

        assertEquals(user.id(), repository.findByEmail("bob@example.COM").await().indefinitely().orElseThrow().id());
    }

    @Test
    @DisplayName("should refuse a second user with the same email")
    void shouldRefuseDuplicates() {
        repository.create(User.builder("bob@example.com").build()).await().indefinitely();

        var ex = assertThrows(
                AuthException.class,
                () -> repository.create(User.builder("BOB@example.com").build()).await().indefinitely());
        assertEquals(AuthFailure.ALREADY_EXISTS, ex.failure());
    }

    @Test
    @DisplayName("should report absence as empty")
    void shouldReportAbsenceAsEmpty() {
        assertTrue(repository.findByEmail("ghost@example.com").await().indefinitely().isEmpty());
        assertTrue(repository.findById(UUID.randomUUID()).await().indefinitely().isEmpty());
        assertFalse(repository.markVerified(UUID.randomUUID()).await().indefinitely());
    }

    @Test
    @DisplayName("should apply targeted updates")
    void shouldApplyTargetedUpdates() {
        var user = repository.create(User.builder("bob@example.com").hashedPassword("old").build())
                .await()
                .indefinitely();

        assertTrue(repository.updatePassword(user.id(), "new").await().indefinitely());
        assertTrue(repository.markVerified(user.id()).await().indefinitely());
        assertTrue(repository.markSuperuser(user.id()).await().indefinitely());

        var stored = repository.findById(user.id()).await().indefinitely().orElseThrow();
        assertEquals("new", stored.hashedPassword());
        assertTrue(stored.verified());
        assertTrue(stored.superuser());
    }
}
