package hostedauth.spi;

/**
 * Thrown when a token storage backend cannot be opened or written.
 */
public class StorageProviderException extends RuntimeException {

    private final String provider;

    public StorageProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public StorageProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    /**
     * Name of the provider that failed.
     */
    public String provider() {
        return provider;
    }
}
