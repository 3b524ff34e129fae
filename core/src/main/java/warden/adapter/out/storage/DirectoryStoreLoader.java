package warden.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import warden.core.port.out.ApiKeyRepository;
import warden.core.port.out.CollectionRepository;
import warden.core.port.out.DirectoryStore;
import warden.core.port.out.OneTimeCodeRepository;
import warden.core.port.out.TokenBlacklistRepository;
import warden.core.port.out.UserRepository;
import warden.spi.DirectoryStoreProvider;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProviderException;

/**
 * Discovers directory store providers via ServiceLoader and produces the repositories.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If warden.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class DirectoryStoreLoader {

    private static final Logger LOG = Logger.getLogger(DirectoryStoreLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    private DirectoryStore store;

    @Inject
    public DirectoryStoreLoader(
            @ConfigProperty(name = "warden.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public DirectoryStore directoryStore() {
        return getStore();
    }

    @Produces
    @ApplicationScoped
    public UserRepository userRepository() {
        return getStore().users();
    }

    @Produces
    @ApplicationScoped
    public CollectionRepository collectionRepository() {
        return getStore().collections();
    }

    @Produces
    @ApplicationScoped
    public OneTimeCodeRepository oneTimeCodeRepository() {
        return getStore().oneTimeCodes();
    }

    @Produces
    @ApplicationScoped
    public ApiKeyRepository apiKeyRepository() {
        return getStore().apiKeys();
    }

    @Produces
    @ApplicationScoped
    public TokenBlacklistRepository tokenBlacklistRepository() {
        return getStore().blacklist();
    }

    synchronized DirectoryStore getStore() {
        if (store != null) {
            return store;
        }

        List<DirectoryStoreProvider> providers = new ArrayList<>();
        ServiceLoader.load(DirectoryStoreProvider.class).forEach(providers::add);

        var provider = selectProvider(providers, configuredProvider.orElse(null));
        LOG.infof("Creating directory store from provider: %s (%s)", provider.name(), provider.description());
        store = provider.createDirectoryStore(config);
        return store;
    }

    static DirectoryStoreProvider selectProvider(List<DirectoryStoreProvider> providers, String configured) {
        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No directory store providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d directory store provider(s): %s",
                providers.size(),
                providers.stream().map(DirectoryStoreProvider::name).toList());

        // Explicit configuration takes precedence
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured directory store provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(DirectoryStoreProvider::name).toList()));
        }

        return providers.stream()
                .filter(DirectoryStoreProvider::isAvailable)
                .max(Comparator.comparingInt(DirectoryStoreProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available directory store providers"));
    }
}
