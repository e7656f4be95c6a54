package hostedauth.core.model.error;

import java.util.Optional;

/**
 * The provider's callback or token response could not be turned into a session.
 *
 * <p>Raised when the response carries an {@code error} field, lacks the
 * fields required by the configured response type, or fails state validation.
 */
public class CallbackParseException extends HostedAuthException {

    private final String providerError;

    public CallbackParseException(String message) {
        this(message, null);
    }

    public CallbackParseException(String message, String providerError) {
        super(message);
        this.providerError = providerError;
    }

    /**
     * The value of the provider's {@code error} field, if the provider reported one.
     */
    public Optional<String> providerError() {
        return Optional.ofNullable(providerError);
    }

    @Override
    public String errorType() {
        return "parse";
    }
}
