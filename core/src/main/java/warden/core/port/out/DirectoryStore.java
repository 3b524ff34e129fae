package warden.core.port.out;

/**
 * The set of repositories backing the directory.
 *
 * <p>A storage provider supplies all of them together so that they share one backend.
 */
public interface DirectoryStore {

    UserRepository users();

    CollectionRepository collections();

    OneTimeCodeRepository oneTimeCodes();

    ApiKeyRepository apiKeys();

    TokenBlacklistRepository blacklist();
}
