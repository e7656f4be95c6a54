package hostedauth.spi;

import hostedauth.core.config.HostedUiConfig.StorageConfig;
import hostedauth.core.port.out.KeyValueStorage;

/**
 * SPI for token cache storage backends.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; list
 * them in {@code META-INF/services/hostedauth.spi.TokenStorageProvider}.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>file (priority: 50) - Properties file, survives restarts</li>
 *   <li>memory (priority: 0) - In-process map, always available</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (hostedauth.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
public interface TokenStorageProvider {

    /**
     * Return the provider name used in {@code hostedauth.storage.provider}.
     *
     * @return Provider name (e.g., "memory", "file")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check whether this provider can run with the given settings.
     *
     * @param config storage settings
     * @return true if the provider can be used
     */
    boolean isAvailable(StorageConfig config);

    /**
     * Create the storage backend.
     *
     * @param config storage settings
     * @return storage instance
     * @throws StorageProviderException if the backend cannot be opened
     */
    KeyValueStorage createStorage(StorageConfig config);
}
