package hostedauth.adapter.out.storage.file;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Properties;

import org.jboss.logging.Logger;

import hostedauth.core.port.out.KeyValueStorage;
import hostedauth.spi.StorageProviderException;

/**
 * KeyValueStorage backed by a properties file.
 *
 * <p>Entries are held in memory and the whole file is rewritten after every
 * change. Writes go to a sibling temp file that replaces the target, so a
 * crash never leaves a truncated cache behind.
 */
public class FileKeyValueStorage implements KeyValueStorage {

    private static final Logger LOG = Logger.getLogger(FileKeyValueStorage.class);
    private static final String PROVIDER = FileStorageProvider.NAME;

    private final Path file;
    private final Properties entries = new Properties();

    public FileKeyValueStorage(Path file) {
        this.file = file;
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            LOG.debugf("Token cache file %s does not exist yet", file);
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            entries.load(in);
            LOG.debugf("Loaded %d cached entries from %s", entries.size(), file);
        } catch (IOException e) {
            throw new StorageProviderException(PROVIDER, "Failed to read token cache file " + file, e);
        }
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.getProperty(key));
    }

    @Override
    public synchronized void set(String key, String value) {
        if (value == null) {
            remove(key);
            return;
        }
        entries.setProperty(key, value);
        flush();
    }

    @Override
    public synchronized void remove(String key) {
        if (entries.remove(key) != null) {
            flush();
        }
    }

    private void flush() {
        try {
            final var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final var temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                entries.store(out, null);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageProviderException(PROVIDER, "Failed to write token cache file " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
