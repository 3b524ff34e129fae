package warden.adapter.out.storage.memory;

import warden.core.port.out.ApiKeyRepository;
import warden.core.port.out.CollectionRepository;
import warden.core.port.out.DirectoryStore;
import warden.core.port.out.OneTimeCodeRepository;
import warden.core.port.out.TokenBlacklistRepository;
import warden.core.port.out.UserRepository;

/**
 * Directory store backed by process memory.
 *
 * <p>Data is NOT persisted across restarts.
 */
public class InMemoryDirectoryStore implements DirectoryStore {

    private final InMemoryUserRepository users;
    private final InMemoryCollectionRepository collections = new InMemoryCollectionRepository();
    private final InMemoryOneTimeCodeRepository oneTimeCodes = new InMemoryOneTimeCodeRepository();
    private final InMemoryApiKeyRepository apiKeys = new InMemoryApiKeyRepository();
    private final InMemoryTokenBlacklistRepository blacklist;

    public InMemoryDirectoryStore() {
        this(InMemoryUserRepository.DEFAULT_INITIAL_CAPACITY);
    }

    /**
     * @param initialCapacity expected number of users and blacklisted tokens
     */
    public InMemoryDirectoryStore(int initialCapacity) {
        this.users = new InMemoryUserRepository(initialCapacity);
        this.blacklist = new InMemoryTokenBlacklistRepository(initialCapacity);
    }

    @Override
    public UserRepository users() {
        return users;
    }

    @Override
    public InMemoryCollectionRepository collections() {
        return collections;
    }

    @Override
    public OneTimeCodeRepository oneTimeCodes() {
        return oneTimeCodes;
    }

    @Override
    public ApiKeyRepository apiKeys() {
        return apiKeys;
    }

    @Override
    public TokenBlacklistRepository blacklist() {
        return blacklist;
    }
}
