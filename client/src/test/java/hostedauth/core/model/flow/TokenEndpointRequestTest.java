package hostedauth.core.model.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenEndpointRequest")
class TokenEndpointRequestTest {

    private static final String ENDPOINT = "https://auth.example.com/oauth2/token";

    @Test
    @DisplayName("should emit code grant fields in wire order")
    void shouldEmitCodeGrantFields() {
        var request = new TokenEndpointRequest(
                ENDPOINT, GrantType.AUTHORIZATION_CODE, "code-1", "client-123", "https://app/cb");

        var fields = request.formFields();

        assertEquals(List.of("grant_type", "code", "client_id", "redirect_uri"), List.copyOf(fields.keySet()));
        assertEquals("authorization_code", fields.get("grant_type"));
        assertEquals("code-1", fields.get("code"));
    }

    @Test
    @DisplayName("should send refresh token under refresh_token and omit blank redirect URI")
    void shouldEmitRefreshGrantFields() {
        var request = new TokenEndpointRequest(ENDPOINT, GrantType.REFRESH_TOKEN, "r-1", "client-123", " ");

        var fields = request.formFields();

        assertEquals("refresh_token", fields.get("grant_type"));
        assertEquals("r-1", fields.get("refresh_token"));
        assertFalse(fields.containsKey("redirect_uri"));
    }

    @Test
    @DisplayName("should reject a missing credential")
    void shouldRejectMissingCredential() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new TokenEndpointRequest(ENDPOINT, GrantType.REFRESH_TOKEN, "", "client-123", null));
    }
}
