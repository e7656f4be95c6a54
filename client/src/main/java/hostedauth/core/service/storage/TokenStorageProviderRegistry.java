package hostedauth.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import org.jboss.logging.Logger;

import hostedauth.core.config.HostedUiConfig.StorageConfig;
import hostedauth.core.port.out.KeyValueStorage;
import hostedauth.spi.TokenStorageProvider;

/**
 * Registry for token storage providers.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (hostedauth.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
public class TokenStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(TokenStorageProviderRegistry.class);

    private final List<TokenStorageProvider> providers;
    private final StorageConfig config;

    private TokenStorageProvider selectedProvider;
    private KeyValueStorage storage;

    public TokenStorageProviderRegistry(List<TokenStorageProvider> providers, StorageConfig config) {
        this.providers = List.copyOf(providers);
        this.config = config;
    }

    /**
     * Create a registry over every provider registered with {@link ServiceLoader}.
     *
     * @param config storage settings
     * @return the registry
     */
    public static TokenStorageProviderRegistry discover(StorageConfig config) {
        final var discovered = ServiceLoader.load(TokenStorageProvider.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        return new TokenStorageProviderRegistry(discovered, config);
    }

    /**
     * Get the storage of the selected provider, creating it on first use.
     *
     * @return storage instance
     */
    public synchronized KeyValueStorage getStorage() {
        if (storage == null) {
            storage = getSelectedProvider().createStorage(config);
        }
        return storage;
    }

    public synchronized TokenStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private TokenStorageProvider selectProvider() {
        final var configuredProvider = config.provider();
        final var availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(TokenStorageProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available token storage providers: %s",
                availableProviders.stream().map(TokenStorageProvider::name).toList());

        Optional<TokenStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.debugf("Using configured token storage provider: %s", configuredProvider);
            return configured.get();
        }

        LOG.warnf("Configured token storage provider '%s' is not available, falling back", configuredProvider);

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using token storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No token storage providers available");
    }

    public List<TokenStorageProvider> getAvailableProviders() {
        return providers.stream().filter(p -> p.isAvailable(config)).toList();
    }
}
