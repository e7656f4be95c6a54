package hostedauth.core.model.error;

/**
 * Transport failure talking to the token endpoint.
 *
 * <p>Covers non-2xx responses, unreadable bodies and connection errors. An
 * {@code error} field inside a successful response is not a transport failure.
 */
public class TokenEndpointException extends HostedAuthException {

    private final int statusCode;
    private final String responseBody;

    public TokenEndpointException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public TokenEndpointException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    /**
     * HTTP status returned by the endpoint, or -1 if no response was received.
     */
    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }

    @Override
    public String errorType() {
        return "token_endpoint";
    }
}
