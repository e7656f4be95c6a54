package hostedauth.core.model.error;

/**
 * A session could not be written to the token cache.
 */
public class SessionCacheException extends HostedAuthException {

    public SessionCacheException(String message) {
        super(message);
    }

    public SessionCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "cache";
    }
}
