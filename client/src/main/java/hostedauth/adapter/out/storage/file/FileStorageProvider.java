package hostedauth.adapter.out.storage.file;

import java.nio.file.Path;

import org.jboss.logging.Logger;

import hostedauth.core.config.HostedUiConfig.StorageConfig;
import hostedauth.core.port.out.KeyValueStorage;
import hostedauth.spi.TokenStorageProvider;

/**
 * File-backed token storage provider.
 *
 * <p>Available when {@code hostedauth.storage.file.path} is set.
 */
public class FileStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(FileStorageProvider.class);

    static final String NAME = "file";
    private static final int PRIORITY = 50;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable(StorageConfig config) {
        return config.file().path().filter(p -> !p.isBlank()).isPresent();
    }

    @Override
    public KeyValueStorage createStorage(StorageConfig config) {
        final var path = Path.of(config.file().path().orElseThrow());
        LOG.infof("Caching tokens in %s", path.toAbsolutePath());
        return new FileKeyValueStorage(path);
    }
}
