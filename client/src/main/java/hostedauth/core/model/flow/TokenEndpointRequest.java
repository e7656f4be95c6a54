package hostedauth.core.model.flow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A grant sent to the hosted UI token endpoint.
 *
 * @param tokenEndpoint the absolute token endpoint URL
 * @param grantType     authorization code or refresh token
 * @param credential    the code or refresh token being exchanged
 * @param clientId      the application client ID
 * @param redirectUri   the sign-in redirect URI used for the authorization request
 */
public record TokenEndpointRequest(
        String tokenEndpoint, GrantType grantType, String credential, String clientId, String redirectUri) {

    public TokenEndpointRequest {
        if (tokenEndpoint == null || tokenEndpoint.isBlank()) {
            throw new IllegalArgumentException("Token endpoint is required");
        }
        if (grantType == null) {
            throw new IllegalArgumentException("Grant type is required");
        }
        if (credential == null || credential.isBlank()) {
            throw new IllegalArgumentException("Grant credential is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID is required");
        }
    }

    /**
     * Form fields in wire order: grant_type, code or refresh_token, client_id, redirect_uri.
     */
    public Map<String, String> formFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("grant_type", grantType.wireValue());
        fields.put(grantType.credentialParameter(), credential);
        fields.put("client_id", clientId);
        if (redirectUri != null && !redirectUri.isBlank()) {
            fields.put("redirect_uri", redirectUri);
        }
        return fields;
    }
}
