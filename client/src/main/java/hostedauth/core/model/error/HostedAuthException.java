package hostedauth.core.model.error;

/**
 * Base type for every failure raised by the hosted UI flow.
 *
 * <p>Construction errors are thrown directly. Everything raised while
 * resolving or refreshing a session is delivered through the flow's failure
 * channel instead: the registered session handler, or a failed {@code Uni}.
 */
public abstract class HostedAuthException extends RuntimeException {

    protected HostedAuthException(String message) {
        super(message);
    }

    protected HostedAuthException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short, stable name of the failure, used as a metric tag.
     */
    public abstract String errorType();
}
