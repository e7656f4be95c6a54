package hostedauth.core.model.flow;

/**
 * Grant types sent to the token endpoint.
 */
public enum GrantType {
    AUTHORIZATION_CODE("authorization_code", "code"),
    REFRESH_TOKEN("refresh_token", "refresh_token");

    private final String wireValue;
    private final String credentialParameter;

    GrantType(String wireValue, String credentialParameter) {
        this.wireValue = wireValue;
        this.credentialParameter = credentialParameter;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Name of the form parameter carrying the grant's credential.
     */
    public String credentialParameter() {
        return credentialParameter;
    }
}
