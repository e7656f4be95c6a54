package hostedauth.core.model.error;

/**
 * The token endpoint rejected a refresh grant.
 */
public class TokenRefreshException extends HostedAuthException {

    private final String providerError;

    public TokenRefreshException(String providerError) {
        super("Token endpoint rejected the refresh token: " + providerError);
        this.providerError = providerError;
    }

    public String providerError() {
        return providerError;
    }

    @Override
    public String errorType() {
        return "refresh";
    }
}
