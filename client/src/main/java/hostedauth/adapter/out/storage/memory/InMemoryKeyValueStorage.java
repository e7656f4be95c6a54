package hostedauth.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.logging.Logger;

import hostedauth.core.port.out.KeyValueStorage;

/**
 * In-memory implementation of KeyValueStorage.
 *
 * <p>Cached tokens are lost when the process exits.
 */
public class InMemoryKeyValueStorage implements KeyValueStorage {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueStorage.class);

    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            remove(key);
            return;
        }
        entries.put(key, value);
        LOG.tracef("Stored %s", key);
    }

    @Override
    public void remove(String key) {
        if (entries.remove(key) != null) {
            LOG.tracef("Removed %s", key);
        }
    }

    /**
     * Get the number of stored entries (for testing/monitoring).
     */
    public int size() {
        return entries.size();
    }
}
