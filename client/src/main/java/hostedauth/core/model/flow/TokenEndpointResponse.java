package hostedauth.core.model.flow;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Body of a 2xx token endpoint response.
 *
 * <p>All fields are optional. A present {@code error} means the grant was
 * rejected even though the transport succeeded.
 *
 * @param idToken          the ID token
 * @param accessToken      the access token
 * @param refreshToken     the refresh token (code grants only)
 * @param error            the OAuth2 error code
 * @param errorDescription human readable error detail
 */
public record TokenEndpointResponse(
        Optional<String> idToken,
        Optional<String> accessToken,
        Optional<String> refreshToken,
        Optional<String> error,
        Optional<String> errorDescription) {

    public TokenEndpointResponse {
        idToken = idToken == null ? Optional.empty() : idToken;
        accessToken = accessToken == null ? Optional.empty() : accessToken;
        refreshToken = refreshToken == null ? Optional.empty() : refreshToken;
        error = error == null ? Optional.empty() : error;
        errorDescription = errorDescription == null ? Optional.empty() : errorDescription;
    }

    public boolean hasError() {
        return error.isPresent();
    }

    /**
     * The response as the same field mapping a callback produces.
     */
    public ResponseParameters toParameters() {
        var values = new LinkedHashMap<String, String>();
        idToken.ifPresent(v -> values.put(ResponseParameters.ID_TOKEN, v));
        accessToken.ifPresent(v -> values.put(ResponseParameters.ACCESS_TOKEN, v));
        refreshToken.ifPresent(v -> values.put(ResponseParameters.REFRESH_TOKEN, v));
        error.ifPresent(v -> values.put(ResponseParameters.ERROR, v));
        errorDescription.ifPresent(v -> values.put(ResponseParameters.ERROR_DESCRIPTION, v));
        return new ResponseParameters(values);
    }
}
