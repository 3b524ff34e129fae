package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.account.User;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProviderException;

@DisplayName("InMemoryDirectoryStoreProvider")
class InMemoryDirectoryStoreProviderTest {

    private final InMemoryDirectoryStoreProvider provider = new InMemoryDirectoryStoreProvider();

    private static StorageAdapterConfig config(Map<String, String> values) {
        return key -> Optional.ofNullable(values.get(key));
    }

    @Test
    @DisplayName("should create a working store with the default capacity")
    void shouldCreateStoreWithDefaults() {
        var store = provider.createDirectoryStore(config(Map.of()));

        var user = store.users().create(User.builder("a@example.com").build()).await().indefinitely();

        assertInstanceOf(InMemoryDirectoryStore.class, store);
        assertEquals(user.id(), store.users().findByEmail("A@example.com").await().indefinitely().orElseThrow().id());
    }

    @Test
    @DisplayName("should accept a configured initial capacity")
    void shouldAcceptConfiguredCapacity() {
        var store = provider.createDirectoryStore(
                config(Map.of(InMemoryDirectoryStoreProvider.INITIAL_CAPACITY_KEY, " 1024 ")));

        assertTrue(store.blacklist().blacklist("t", Instant.MAX).await().indefinitely());
    }

    @Test
    @DisplayName("should refuse a non-numeric initial capacity")
    void shouldRefuseNonNumericCapacity() {
        var ex = assertThrows(
                StorageProviderException.class,
                () -> provider.createDirectoryStore(
                        config(Map.of(InMemoryDirectoryStoreProvider.INITIAL_CAPACITY_KEY, "lots"))));

        assertTrue(ex.getMessage().contains(InMemoryDirectoryStoreProvider.INITIAL_CAPACITY_KEY));
    }

    @Test
    @DisplayName("should refuse a non-positive initial capacity")
    void shouldRefuseNonPositiveCapacity() {
        assertThrows(
                StorageProviderException.class,
                () -> provider.createDirectoryStore(
                        config(Map.of(InMemoryDirectoryStoreProvider.INITIAL_CAPACITY_KEY, "0"))));
    }
}
