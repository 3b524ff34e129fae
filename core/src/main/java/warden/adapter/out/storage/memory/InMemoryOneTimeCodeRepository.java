package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.OneTimeCodePurpose;
import warden.core.port.out.OneTimeCodeRepository;

/**
 * In-memory implementation of OneTimeCodeRepository.
 *
 * <p>Holds one slot per user and purpose. Lookups by code scan the slots of that purpose.
 */
public class InMemoryOneTimeCodeRepository implements OneTimeCodeRepository {

    private record Slot(String code, Instant expiresAt) {}

    private record SlotKey(OneTimeCodePurpose purpose, UUID userId) {}

    private final ConcurrentHashMap<SlotKey, Slot> slots = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> store(UUID userId, OneTimeCodePurpose purpose, String code, Instant expiresAt) {
        return Uni.createFrom().item(() -> {
            slots.put(new SlotKey(purpose, userId), new Slot(code, expiresAt));
            return null;
        });
    }

    @Override
    public Uni<Optional<UUID>> findUserId(OneTimeCodePurpose purpose, String code) {
        return Uni.createFrom().item(() -> {
            var now = Instant.now();
            return slots.entrySet().stream()
                    .filter(e -> e.getKey().purpose() == purpose)
                    .filter(e -> e.getValue().code().equals(code))
                    .filter(e -> e.getValue().expiresAt().isAfter(now))
                    .map(e -> e.getKey().userId())
                    .findFirst();
        });
    }

    @Override
    public Uni<Boolean> removeByCode(OneTimeCodePurpose purpose, String code) {
        return Uni.createFrom().item(() -> slots.entrySet()
                .removeIf(e -> e.getKey().purpose() == purpose && e.getValue().code().equals(code)));
    }

    @Override
    public Uni<Boolean> removeForUser(OneTimeCodePurpose purpose, UUID userId) {
        return Uni.createFrom().item(() -> slots.remove(new SlotKey(purpose, userId)) != null);
    }
}
