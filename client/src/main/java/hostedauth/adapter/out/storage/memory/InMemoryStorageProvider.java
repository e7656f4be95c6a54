package hostedauth.adapter.out.storage.memory;

import java.util.concurrent.atomic.AtomicBoolean;

import org.jboss.logging.Logger;

import hostedauth.core.config.HostedUiConfig.StorageConfig;
import hostedauth.core.port.out.KeyValueStorage;
import hostedauth.spi.TokenStorageProvider;

/**
 * In-memory token storage provider.
 *
 * <p>Always available; used when no persistent backend is configured.
 */
public class InMemoryStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable(StorageConfig config) {
        return true;
    }

    @Override
    public KeyValueStorage createStorage(StorageConfig config) {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.info("Token cache is in-memory only; users sign in again after a restart");
        }
        return new InMemoryKeyValueStorage();
    }
}
