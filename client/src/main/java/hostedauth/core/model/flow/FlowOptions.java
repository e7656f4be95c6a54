package hostedauth.core.model.flow;

import java.util.List;

import hostedauth.core.model.error.ConfigurationException;
import hostedauth.core.model.error.ScopeTypeException;
import hostedauth.core.model.token.TokenScopes;

/**
 * Settings of one hosted UI client.
 *
 * @param clientId              the application client ID registered with the provider
 * @param domain                the hosted UI domain, without scheme
 * @param redirectUriSignIn     where the provider sends the user after sign-in
 * @param redirectUriSignOut    where the provider sends the user after sign-out
 * @param scopes                the scopes to request
 * @param identityProvider      pre-selected identity provider, or null
 * @param userPoolId            user pool passed to the context data provider, or null
 * @param responseType          initial response type
 * @param contextDataCollection whether risk context data is attached to sign-in URLs
 * @param stateValidation       whether callbacks must echo the outstanding CSRF state
 */
public record FlowOptions(
        String clientId,
        String domain,
        String redirectUriSignIn,
        String redirectUriSignOut,
        List<String> scopes,
        String identityProvider,
        String userPoolId,
        ResponseType responseType,
        boolean contextDataCollection,
        boolean stateValidation) {

    public FlowOptions {
        requireSetting(clientId, "client ID");
        requireSetting(domain, "domain");
        requireSetting(redirectUriSignIn, "sign-in redirect URI");
        requireSetting(redirectUriSignOut, "sign-out redirect URI");
        if (scopes == null) {
            throw new ScopeTypeException("Scopes must be a list of scope names");
        }
        for (String scope : scopes) {
            if (scope == null || scope.isBlank() || scope.chars().anyMatch(Character::isWhitespace)) {
                throw new ScopeTypeException("Invalid scope name: '" + scope + "'");
            }
        }
        scopes = List.copyOf(scopes);
        if (responseType == null) {
            responseType = ResponseType.IMPLICIT;
        }
    }

    /**
     * Options with defaults for everything that is optional.
     */
    public static FlowOptions of(
            String clientId, String domain, String redirectUriSignIn, String redirectUriSignOut, List<String> scopes) {
        return new FlowOptions(
                clientId,
                domain,
                redirectUriSignIn,
                redirectUriSignOut,
                scopes,
                null,
                null,
                ResponseType.IMPLICIT,
                false,
                false);
    }

    public TokenScopes tokenScopes() {
        return TokenScopes.of(scopes);
    }

    public FlowOptions withResponseType(ResponseType type) {
        return new FlowOptions(
                clientId,
                domain,
                redirectUriSignIn,
                redirectUriSignOut,
                scopes,
                identityProvider,
                userPoolId,
                type,
                contextDataCollection,
                stateValidation);
    }

    public FlowOptions withIdentityProvider(String provider) {
        return new FlowOptions(
                clientId,
                domain,
                redirectUriSignIn,
                redirectUriSignOut,
                scopes,
                provider,
                userPoolId,
                responseType,
                contextDataCollection,
                stateValidation);
    }

    private static void requireSetting(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Hosted UI " + name + " is required");
        }
    }
}
