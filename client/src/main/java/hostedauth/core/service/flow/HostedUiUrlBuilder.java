package hostedauth.core.service.flow;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import hostedauth.core.model.flow.FlowOptions;
import hostedauth.core.model.flow.ResponseType;
import hostedauth.core.model.token.TokenScopes;

/**
 * Builds the hosted UI endpoint URLs of one client.
 *
 * <p>Query parameters are always emitted in the same order so that equal
 * inputs give byte-identical URLs.
 */
public class HostedUiUrlBuilder {

    static final String SCHEME = "https://";
    static final String AUTHORIZE_PATH = "/oauth2/authorize";
    static final String TOKEN_PATH = "/oauth2/token";
    static final String SIGN_OUT_PATH = "/logout";

    private final String domain;
    private final String clientId;
    private final String redirectUriSignIn;
    private final String redirectUriSignOut;

    public HostedUiUrlBuilder(FlowOptions options) {
        this.domain = options.domain();
        this.clientId = options.clientId();
        this.redirectUriSignIn = options.redirectUriSignIn();
        this.redirectUriSignOut = options.redirectUriSignOut();
    }

    /**
     * Build the authorize URL.
     *
     * <p>Parameter order: redirect_uri, response_type, client_id, state, scope,
     * then identity_provider and userContextData when given.
     *
     * @param responseType     the grant to request
     * @param state            the CSRF state
     * @param scopes           the scopes to request
     * @param identityProvider pre-selected identity provider, or null
     * @param userContextData  opaque risk context payload, or null
     * @return the sign-in URL
     */
    public String signInUrl(
            ResponseType responseType,
            String state,
            TokenScopes scopes,
            String identityProvider,
            String userContextData) {
        var url = new StringBuilder(SCHEME)
                .append(domain)
                .append(AUTHORIZE_PATH)
                .append("?redirect_uri=")
                .append(encode(redirectUriSignIn))
                .append("&response_type=")
                .append(responseType.wireValue())
                .append("&client_id=")
                .append(clientId)
                .append("&state=")
                .append(state)
                .append("&scope=")
                .append(encode(scopes.toSpaceDelimited()));

        if (identityProvider != null && !identityProvider.isBlank()) {
            url.append("&identity_provider=").append(encode(identityProvider));
        }
        if (userContextData != null && !userContextData.isEmpty()) {
            url.append("&userContextData=").append(encode(userContextData));
        }
        return url.toString();
    }

    /**
     * Build the sign-out URL: redirect_uri then client_id.
     */
    public String signOutUrl() {
        return SCHEME + domain + SIGN_OUT_PATH + "?redirect_uri=" + encode(redirectUriSignOut) + "&client_id="
                + clientId;
    }

    public String tokenUrl() {
        return SCHEME + domain + TOKEN_PATH;
    }

    public String redirectUriSignIn() {
        return redirectUriSignIn;
    }

    // Form-style percent-encoding with spaces as %20
    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
