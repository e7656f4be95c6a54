package hostedauth.core.port.out;

import java.util.Optional;

/**
 * Outbound port for the medium that persists cached tokens.
 *
 * <p>Operations are synchronous. Each write is atomic on its own; there is
 * no transaction across keys.
 */
public interface KeyValueStorage {

    /**
     * Read a value.
     *
     * @param key storage key
     * @return the value, or empty if the key is absent
     */
    Optional<String> get(String key);

    /**
     * Store a value, replacing any previous one.
     *
     * @param key   storage key
     * @param value value to store; null removes the key
     */
    void set(String key, String value);

    /**
     * Remove a key. Removing an absent key is not an error.
     *
     * @param key storage key
     */
    void remove(String key);
}
