package hostedauth.core.model.error;

/**
 * A refresh was requested while the flow is configured for the implicit grant.
 */
public class RefreshTypeException extends HostedAuthException {

    public RefreshTypeException() {
        super("Token refresh is only supported with the authorization code grant");
    }

    @Override
    public String errorType() {
        return "refresh_type";
    }
}
