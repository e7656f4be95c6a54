package hostedauth.core.model.error;

/**
 * The configured scopes are not a proper list of scope names.
 */
public class ScopeTypeException extends HostedAuthException {

    public ScopeTypeException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "scope_type";
    }
}
