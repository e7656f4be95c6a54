package hostedauth.core.model.flow;

import java.util.Locale;

import hostedauth.core.model.error.ConfigurationException;

/**
 * OAuth2 response types supported by the hosted UI.
 */
public enum ResponseType {
    /**
     * Implicit grant. Tokens arrive in the redirect fragment.
     */
    IMPLICIT("token"),

    /**
     * Authorization code grant. A code arrives in the redirect query and is
     * exchanged at the token endpoint.
     */
    AUTHORIZATION_CODE("code");

    private final String wireValue;

    ResponseType(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * The value sent as {@code response_type}.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parse a configured response type.
     *
     * <p>Accepts the wire values ({@code token}, {@code code}) and the grant
     * names ({@code implicit}, {@code authorization_code}).
     *
     * @param value the configured value
     * @return the response type
     * @throws ConfigurationException if the value is not recognised
     */
    public static ResponseType fromConfig(String value) {
        if (value == null) {
            throw new ConfigurationException("Response type is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "token", "implicit" -> IMPLICIT;
            case "code", "authorization_code", "authorization-code" -> AUTHORIZATION_CODE;
            default -> throw new ConfigurationException("Unsupported response type: " + value);
        };
    }
}
